package com.astmutator.parser;

import com.github.javaparser.ast.Node;

public interface SourceParser {

    /**
     * Parses a complete source file.
     *
     * @throws com.github.javaparser.ParseProblemException on invalid syntax
     */
    Node parse(String sourceText);
}
