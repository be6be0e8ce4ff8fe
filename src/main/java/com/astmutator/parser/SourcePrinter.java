package com.astmutator.parser;

import com.github.javaparser.ast.Node;

public interface SourcePrinter {
    String print(Node node);
}
