package org.dynamis.builder.compiler;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileManager;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;

import org.dynamis.builder.BuilderCompileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles generated sources with the system javac without touching the file system.
 */
public class InMemoryJavaCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryJavaCompiler.class);

    private final List<String> options;

    public InMemoryJavaCompiler() {
        this(List.of("-proc:none", "-classpath", System.getProperty("java.class.path")));
    }

    public InMemoryJavaCompiler(List<String> options) {
        this.options = List.copyOf(options);
    }

    /**
     * @param sources source text keyed by the binary name of its top-level class
     * @return class bytes keyed by binary name, nested classes included
     */
    public Map<String, byte[]> compile(Map<String, String> sources) {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new BuilderCompileException("No system Java compiler available, a JDK is required",
                                              joined(sources), null);
        }
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        List<JavaFileObject> units = new ArrayList<>();
        sources.forEach((name, source) -> units.add(new SourceFile(name, source)));

        Map<String, ByteArrayOutputStream> outputs = new TreeMap<>();
        try (StandardJavaFileManager standard = compiler.getStandardFileManager(diagnostics, Locale.ROOT, null);
             JavaFileManager fileManager = new ClassCollector(standard, outputs)) {
            boolean success = compiler.getTask(null, fileManager, diagnostics, options, null, units).call();
            if (!success) {
                String report = diagnostics.getDiagnostics().stream()
                        .filter(diagnostic -> diagnostic.getKind() == Diagnostic.Kind.ERROR)
                        .map(InMemoryJavaCompiler::format)
                        .collect(Collectors.joining("\n"));
                throw new BuilderCompileException("Compilation of generated sources failed", joined(sources), report);
            }
        } catch (IOException e) {
            throw new BuilderCompileException("Compiler file manager failed", joined(sources), e.getMessage(), e);
        }

        Map<String, byte[]> classes = new TreeMap<>();
        outputs.forEach((name, bytes) -> classes.put(name, bytes.toByteArray()));
        LOG.debug("Compiled {} source(s) into {} class(es)", sources.size(), classes.size());
        return classes;
    }

    private static String format(Diagnostic<? extends JavaFileObject> diagnostic) {
        String file = diagnostic.getSource() == null ? "<unknown>" : diagnostic.getSource().getName();
        return file + ":" + diagnostic.getLineNumber() + ": " + diagnostic.getMessage(Locale.ROOT);
    }

    private static String joined(Map<String, String> sources) {
        return String.join("\n", sources.values());
    }

    private static final class SourceFile extends SimpleJavaFileObject {

        private final String source;

        SourceFile(String binaryName, String source) {
            super(URI.create("string:///" + binaryName.replace('.', '/') + Kind.SOURCE.extension), Kind.SOURCE);
            this.source = source;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return source;
        }
    }

    private static final class ClassFile extends SimpleJavaFileObject {

        private final ByteArrayOutputStream bytes;

        ClassFile(String binaryName, ByteArrayOutputStream bytes) {
            super(URI.create("bytes:///" + binaryName.replace('.', '/') + Kind.CLASS.extension), Kind.CLASS);
            this.bytes = bytes;
        }

        @Override
        public OutputStream openOutputStream() {
            return bytes;
        }
    }

    private static final class ClassCollector extends ForwardingJavaFileManager<StandardJavaFileManager> {

        private final Map<String, ByteArrayOutputStream> outputs;

        ClassCollector(StandardJavaFileManager fileManager, Map<String, ByteArrayOutputStream> outputs) {
            super(fileManager);
            this.outputs = outputs;
        }

        @Override
        public JavaFileObject getJavaFileForOutput(Location location, String className, JavaFileObject.Kind kind,
                                                   FileObject sibling) {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            outputs.put(className, bytes);
            return new ClassFile(className, bytes);
        }
    }
}
