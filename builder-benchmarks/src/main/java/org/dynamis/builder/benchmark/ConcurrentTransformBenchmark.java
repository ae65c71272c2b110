package org.dynamis.builder.benchmark;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import org.dynamis.builder.BuilderTransform;
import org.dynamis.builder.TransformResult;
import org.dynamis.builder.benchmark.domain.MarkupSources;
import org.dynamis.builder.capability.CapabilityResolver;
import org.dynamis.builder.parser.BuilderSourceParser;
import org.openjdk.jmh.annotations.*;

/**
 * Two threads transforming different bodies against one shared {@link CapabilityResolver} and
 * {@link BuilderTransform}. Exercises the resolver cache under contention.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(2)
public class ConcurrentTransformBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        final CapabilityResolver resolver = new CapabilityResolver();
        final BuilderTransform transform = new BuilderTransform();
        TypeDeclaration<?> markup;
        BlockStmt[] bodies;

        @Setup(Level.Trial)
        public void init() {
            BuilderSourceParser parser = new BuilderSourceParser();
            markup = parser.parseCompilationUnit(MarkupSources.BUILDER).getType(0);
            CompilationUnit pages = parser.parseCompilationUnit(MarkupSources.PAGES);
            bodies = new BlockStmt[] {
                    pages.getType(0).getMethodsByName("branching").get(0).getBody().orElseThrow(),
                    pages.getType(0).getMethodsByName("listing").get(0).getBody().orElseThrow()
            };
        }

        @Setup(Level.Iteration)
        public void clearCache() {
            resolver.clear();
        }
    }

    @State(Scope.Thread)
    public static class ThreadState {

        private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);
        int threadIndex;

        @Setup(Level.Trial)
        public void init() {
            threadIndex = THREAD_COUNTER.getAndIncrement() % 2;
        }
    }

    @Benchmark
    public TransformResult concurrentTransformDifferentBodies(SharedState shared, ThreadState local) {
        return shared.transform.transform(shared.bodies[local.threadIndex], shared.resolver.resolve(shared.markup),
                                          false);
    }
}
