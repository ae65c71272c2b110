package org.dynamis.builder.benchmark;

import java.util.concurrent.TimeUnit;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import org.dynamis.builder.BuilderTransform;
import org.dynamis.builder.TransformResult;
import org.dynamis.builder.benchmark.domain.MarkupSources;
import org.dynamis.builder.capability.BuilderCapabilities;
import org.dynamis.builder.capability.CapabilityResolver;
import org.dynamis.builder.parser.BuilderSourceParser;
import org.openjdk.jmh.annotations.*;

/**
 * Measures the source-to-source rewrite of one function body, without javac. This is the cost
 * the transform adds on top of an ordinary compilation.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class TransformCostBenchmark {

    @State(Scope.Thread)
    public static class BodyState {

        final BuilderTransform transform = new BuilderTransform();
        BuilderCapabilities capabilities;
        BlockStmt straight;
        BlockStmt branching;
        BlockStmt listing;

        @Setup(Level.Trial)
        public void init() {
            BuilderSourceParser parser = new BuilderSourceParser();
            TypeDeclaration<?> markup = parser.parseCompilationUnit(MarkupSources.BUILDER).getType(0);
            capabilities = new CapabilityResolver().resolve(markup);

            CompilationUnit pages = parser.parseCompilationUnit(MarkupSources.PAGES);
            straight = body(pages, "straight");
            branching = body(pages, "branching");
            listing = body(pages, "listing");
        }

        private static BlockStmt body(CompilationUnit unit, String method) {
            return unit.getType(0).getMethodsByName(method).get(0).getBody().orElseThrow();
        }
    }

    @Benchmark
    public TransformResult transformStraightBody(BodyState state) {
        return state.transform.transform(state.straight, state.capabilities, false);
    }

    @Benchmark
    public TransformResult transformBranchingBody(BodyState state) {
        return state.transform.transform(state.branching, state.capabilities, false);
    }

    @Benchmark
    public TransformResult transformLoopBody(BodyState state) {
        return state.transform.transform(state.listing, state.capabilities, false);
    }
}
