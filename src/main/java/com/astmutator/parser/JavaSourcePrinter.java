package com.astmutator.parser;

import com.github.javaparser.ast.Node;
import com.github.javaparser.printer.DefaultPrettyPrinter;
import org.springframework.stereotype.Component;

@Component
public class JavaSourcePrinter implements SourcePrinter {

    private final DefaultPrettyPrinter printer = new DefaultPrettyPrinter();

    @Override
    public String print(Node node) {
        return printer.print(node);
    }
}
