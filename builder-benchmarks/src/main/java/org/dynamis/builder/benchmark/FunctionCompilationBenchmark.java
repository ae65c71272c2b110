package org.dynamis.builder.benchmark;

import java.util.List;
import java.util.concurrent.TimeUnit;

import org.dynamis.builder.benchmark.domain.MarkupSources;
import org.dynamis.builder.compiler.BuilderFunctionCompiler;
import org.dynamis.builder.compiler.CompiledFunctions;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Full cost of turning builder functions into loaded classes: parse, transform, javac and
 * define. Compare with {@link TransformCostBenchmark} to see the transform's share.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class FunctionCompilationBenchmark {

    @State(Scope.Thread)
    public static class CompilerState {

        final BuilderFunctionCompiler compiler = new BuilderFunctionCompiler();
        final List<String> sources = List.of(MarkupSources.BUILDER, MarkupSources.PAGES);
        CompiledFunctions compiled;

        @Setup(Level.Trial)
        public void warm() {
            compiled = compiler.compile(sources, MarkupSources.BINDINGS);
        }
    }

    @Benchmark
    public CompiledFunctions compilePages(CompilerState state) {
        return state.compiler.compile(state.sources, MarkupSources.BINDINGS);
    }

    @Benchmark
    public void invokeCompiledPages(CompilerState state, Blackhole blackhole) {
        blackhole.consume(state.compiled.invokeStatic("markup.Pages", "straight", "Title"));
        blackhole.consume(state.compiled.invokeStatic("markup.Pages", "branching", 2));
        blackhole.consume(state.compiled.invokeStatic("markup.Pages", "listing", List.of("a", "b", "c")));
    }
}
