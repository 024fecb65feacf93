package com.textlocator;

import com.textlocator.match.MatchResult;
import com.textlocator.match.TextLocator;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

/**
 * 各级定位策略的耗时基准
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class LocatorBenchmark {

    @State(Scope.Benchmark)
    public static class DocumentState {
        TextLocator locator;
        String content;
        String exactQuery;
        String whitespaceQuery;
        String fuzzyQuery;

        @Setup
        public void setup() {
            locator = new TextLocator();
            StringBuilder builder = new StringBuilder();
            // 约 40KB 的文档，仍在模糊匹配的长度上限内
            for (int i = 0; builder.length() < 40_000; i++) {
                builder.append("Paragraph ").append(i).append(" talks about ")
                    .append(i % 3 == 0 ? "search engines" : i % 3 == 1 ? "text editors" : "version control")
                    .append(" and how people use them every day.\n\n");
            }
            builder.append("The quick brown fox jumps over the lazy dog near the river bank.\n");
            content = builder.toString();
            exactQuery = "quick brown fox jumps over the lazy dog";
            whitespaceQuery = "quick   brown fox\njumps over the lazy dog";
            fuzzyQuery = "quick bown fox jumped over the lazy dog";
        }
    }

    @Benchmark
    public MatchResult exactLocate(DocumentState state) {
        return state.locator.locate(state.content, state.exactQuery);
    }

    @Benchmark
    public MatchResult whitespaceLocate(DocumentState state) {
        return state.locator.locate(state.content, state.whitespaceQuery);
    }

    @Benchmark
    public MatchResult fuzzyLocate(DocumentState state) {
        return state.locator.locate(state.content, state.fuzzyQuery);
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(LocatorBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
