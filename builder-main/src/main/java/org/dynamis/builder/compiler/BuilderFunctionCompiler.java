package org.dynamis.builder.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import org.dynamis.builder.BuilderTransform;
import org.dynamis.builder.BuilderTransformException;
import org.dynamis.builder.TransformOptions;
import org.dynamis.builder.TransformResult;
import org.dynamis.builder.capability.BuilderCapabilities;
import org.dynamis.builder.capability.CapabilityResolver;
import org.dynamis.builder.classify.ReturnScanner;
import org.dynamis.builder.parser.BuilderSourceParser;
import org.dynamis.builder.parser.util.AstUtils;
import org.dynamis.builder.types.SourceIndex;
import org.dynamis.builder.types.SymbolSolverTyper;
import org.dynamis.builder.types.TypeRef;
import org.dynamis.builder.types.TypingScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites the bound builder functions of a set of Java sources, then compiles and loads the result.
 */
public class BuilderFunctionCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(BuilderFunctionCompiler.class);

    private final BuilderSourceParser parser;
    private final CapabilityResolver capabilityResolver;
    private final TransformOptions options;
    private final InMemoryJavaCompiler javac;
    private final SymbolSolverTyper typer = new SymbolSolverTyper();

    public BuilderFunctionCompiler() {
        this(TransformOptions.defaults());
    }

    public BuilderFunctionCompiler(TransformOptions options) {
        this(new BuilderSourceParser(), new CapabilityResolver(), options, new InMemoryJavaCompiler());
    }

    public BuilderFunctionCompiler(BuilderSourceParser parser, CapabilityResolver capabilityResolver,
                                   TransformOptions options, InMemoryJavaCompiler javac) {
        this.parser = parser;
        this.capabilityResolver = capabilityResolver;
        this.options = options;
        this.javac = javac;
    }

    /**
     * Parses and rewrites without compiling. The returned map holds the printed compilation units
     * keyed by the binary name of their primary type.
     */
    public Map<String, String> transformSources(List<String> sources, List<FunctionBinding> bindings,
                                                Map<String, TransformResult> transforms) {
        List<CompilationUnit> units = new ArrayList<>();
        for (String source : sources) {
            units.add(parser.parseCompilationUnit(source));
        }
        SourceIndex index = SourceIndex.of(units);

        for (FunctionBinding binding : bindings) {
            TypeDeclaration<?> owner = find(index, binding.className(), binding);
            TypeDeclaration<?> builderType = find(index, binding.builderName(), binding);
            BuilderCapabilities capabilities = capabilityResolver.resolve(builderType);

            List<MethodDeclaration> methods = owner.getMethodsByName(binding.methodName());
            if (methods.isEmpty()) {
                throw new BuilderTransformException("No method '" + binding.methodName() + "' in " + binding.className(),
                                                    AstUtils.describe(owner));
            }
            for (MethodDeclaration method : methods) {
                transforms.put(key(owner, method), transform(index, method, capabilities));
            }
        }

        Map<String, String> printed = new LinkedHashMap<>();
        for (CompilationUnit unit : units) {
            String packagePrefix = unit.getPackageDeclaration().map(p -> p.getNameAsString() + ".").orElse("");
            String primary = unit.getPrimaryTypeName()
                    .orElseGet(() -> unit.getType(0).getNameAsString());
            printed.put(packagePrefix + primary, unit.toString());
        }
        return printed;
    }

    public CompiledFunctions compile(List<String> sources, List<FunctionBinding> bindings) {
        Map<String, TransformResult> transforms = new LinkedHashMap<>();
        Map<String, String> generated = transformSources(sources, bindings, transforms);
        Map<String, byte[]> byteCode = javac.compile(generated);
        ClassManager classes = new ClassManager();
        classes.define(byteCode);
        LOG.info("Loaded {} class(es) for {} builder function(s)", byteCode.size(), transforms.size());
        return new CompiledFunctions(generated, transforms, classes);
    }

    private TransformResult transform(SourceIndex index, MethodDeclaration method, BuilderCapabilities capabilities) {
        BlockStmt body = method.getBody()
                .orElseThrow(() -> new BuilderTransformException("Builder function has no body",
                                                                 AstUtils.describe(method)));
        TypingScope scope = TypingScope.root();
        for (Parameter parameter : method.getParameters()) {
            TypeRef type = parameter.isVarArgs()
                    ? TypeRef.of(parameter.getType().asString() + "[]")
                    : TypeRef.of(parameter.getType());
            scope.declare(parameter.getNameAsString(), type);
        }
        BuilderTransform transform = new BuilderTransform(typer, index.resolution(), options);
        TransformResult result = transform.transform(body, capabilities, ReturnScanner.hasNonLocalReturn(body), scope);
        LOG.debug("{} {}", method.getDeclarationAsString(false, false, false), result.status());
        if (result.isTransformed()) {
            method.setBody(result.body());
        }
        return result;
    }

    private static TypeDeclaration<?> find(SourceIndex index, String name, FunctionBinding binding) {
        return index.find(name)
                .orElseThrow(() -> new BuilderTransformException("Unknown type '" + name + "'", binding.toString()));
    }

    /** {@code Pages.page(String,int...)}: distinct for every overload of a bound function. */
    static String key(TypeDeclaration<?> owner, MethodDeclaration method) {
        StringJoiner parameters = new StringJoiner(",", "(", ")");
        for (Parameter parameter : method.getParameters()) {
            parameters.add(parameter.getType().asString() + (parameter.isVarArgs() ? "..." : ""));
        }
        return owner.getNameAsString() + "." + method.getNameAsString() + parameters;
    }
}
