package com.mathtext;

import com.mathtext.pipeline.MathTextPipeline;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

/**
 * 流水线性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms512m", "-Xmx512m"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class PipelineBenchmark {

    @State(Scope.Thread)
    public static class PipelineState {
        MathTextPipeline pipeline;
        String shortAnswer;
        String longAnswer;

        @Setup
        public void setup() {
            pipeline = new MathTextPipeline();
            shortAnswer = "\\(\\mathrm{Cr}\\)\\(^{2+}\\)\\) has 4 unpaired electrons";

            StringBuilder builder = new StringBuilder();
            // 模拟一份包含多步推导的长回答
            for (int i = 0; i < 200; i++) {
                builder.append("Step ").append(i).append(": since \\(x_").append(i).append(" = rac{1}{2\\), ")
                    .append("we get $$\\sum_{k=1}^{n} \\frac{k}{").append(i + 1).append("}$$ and ")
                    .append("\\[\\begin{pmatrix}1&0\\\\0&1\\end{pmatrix}\\] __LATEX_BLOCK_").append(i).append("__. ");
            }
            longAnswer = builder.toString();
        }
    }

    @Benchmark
    public int segmentShort(PipelineState state) {
        return state.pipeline.segments(state.shortAnswer).size();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public String plainTextShort(PipelineState state) {
        return state.pipeline.toPlainText(state.shortAnswer);
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int renderLong(PipelineState state) {
        return state.pipeline.render(state.longAnswer).size();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int analyzeLong(PipelineState state) {
        return state.pipeline.analyze(state.longAnswer).issues().size();
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(PipelineBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
