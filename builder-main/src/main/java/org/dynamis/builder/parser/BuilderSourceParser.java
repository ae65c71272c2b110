package org.dynamis.builder.parser;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.stmt.BlockStmt;
import org.dynamis.builder.BuilderParseException;

/**
 * Parses builder sources at the Java 17 language level and reports the first problem as a
 * {@link BuilderParseException} carrying its position.
 */
public class BuilderSourceParser {

    private final JavaParser parser;

    public BuilderSourceParser() {
        this(new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public BuilderSourceParser(ParserConfiguration configuration) {
        this.parser = new JavaParser(configuration);
    }

    public CompilationUnit parseCompilationUnit(String source) {
        return unwrap(parser.parse(source), source);
    }

    public CompilationUnit parseCompilationUnit(Reader reader) {
        StringWriter source = new StringWriter();
        try (reader) {
            reader.transferTo(source);
        } catch (IOException e) {
            throw new BuilderParseException("Unable to read source: " + e.getMessage(), null, 0, 0, e);
        }
        return parseCompilationUnit(source.toString());
    }

    /** Parses a braced block such as a builder function body. */
    public BlockStmt parseBlock(String source) {
        return unwrap(parser.parseBlock(source), source);
    }

    private static <T> T unwrap(ParseResult<T> result, String source) {
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }
        if (result.getProblems().isEmpty()) {
            throw new BuilderParseException("Unable to parse source", source, 0, 0);
        }
        Problem problem = result.getProblems().get(0);
        Range range = problem.getLocation()
                .flatMap(location -> location.getBegin().getRange())
                .orElse(null);
        int line = range == null ? 0 : range.begin.line;
        int column = range == null ? 0 : range.begin.column;
        throw new BuilderParseException(problem.getVerboseMessage(), source, line, column, problem.getCause().orElse(null));
    }
}
