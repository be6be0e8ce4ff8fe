package com.astmutator.mapper;

import com.astmutator.dto.MutantDto;
import com.astmutator.mutation.Mutation;
import com.astmutator.mutation.MutationGenerator;
import com.astmutator.mutation.operators.StringLiteralOperator;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.NameExpr;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ReportMapperTest {

    @Test
    void shouldMapMutationWithSourcePosition() {
        CompilationUnit unit = StaticJavaParser.parse("class A {\n    String s = \"hi\";\n}\n");
        List<Mutation> found = new ArrayList<>();
        new MutationGenerator(List.of(new StringLiteralOperator())).discover(unit, found::add);

        MutantDto dto = ReportMapper.toDto(found.get(0), "diff", 1);

        assertEquals(0, dto.getId());
        assertEquals("StringLiteralOperator", dto.getOperator());
        assertEquals(found.get(0).getLocation().toString(), dto.getLocation());
        assertEquals(2, dto.getLine());
        assertEquals(16, dto.getColumn());
        assertEquals("\"hi\"", dto.getFromText());
        assertEquals("\"XXhiXX\"", dto.getToText());
        assertEquals(1, dto.getChangedLines());
        assertEquals("diff", dto.getDiff());
        assertNull(dto.getOutputFile());
    }

    @Test
    void shouldCollapseWhitespaceInFragments() {
        NameExpr name = new NameExpr("value");

        assertEquals("value", ReportMapper.getTextSafe(name));
        assertEquals("«missing code fragment»", ReportMapper.getTextSafe(null));
    }
}
