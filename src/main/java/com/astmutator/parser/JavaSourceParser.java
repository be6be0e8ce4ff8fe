package com.astmutator.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ParserConfiguration.LanguageLevel;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JavaParser front end. Syntax errors are reported as JavaParser's own
 * {@link ParseProblemException}, carrying every problem the parser found.
 */
public class JavaSourceParser implements SourceParser {

    private final JavaParser parser;

    public JavaSourceParser() {
        this(LanguageLevel.JAVA_17);
    }

    public JavaSourceParser(LanguageLevel languageLevel) {
        this.parser = new JavaParser(new ParserConfiguration().setLanguageLevel(languageLevel));
    }

    @Override
    public CompilationUnit parse(String sourceText) {
        return unwrap(parser.parse(sourceText));
    }

    public CompilationUnit parse(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    /** Parses a single expression such as {@code 1 * 2 * 3}. */
    public Expression parseExpression(String expression) {
        ParseResult<Expression> result = parser.parseExpression(expression);
        return unwrap(result);
    }

    private static <T extends Node> T unwrap(ParseResult<T> result) {
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }
        throw new ParseProblemException(result.getProblems());
    }
}
