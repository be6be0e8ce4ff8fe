package com.astmutator.mapper;

import com.astmutator.dto.MutantDto;
import com.astmutator.mutation.Mutation;
import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;

public class ReportMapper {

    public static MutantDto toDto(Mutation mutation, String diff, int changedLines) {
        Position begin = mutation.getTarget().getBegin().orElse(null);
        return MutantDto.builder()
                .id(mutation.getId())
                .operator(mutation.getOperatorName())
                .location(mutation.getLocation().toString())
                .line(begin != null ? begin.line : null)
                .column(begin != null ? begin.column : null)
                .fromText(getTextSafe(mutation.getTarget()))
                .toText(getTextSafe(mutation.getReplacement()))
                .changedLines(changedLines)
                .diff(diff)
                .build();
    }

    static String getTextSafe(Node node) {
        if (node == null) {
            return "«missing code fragment»";
        }
        try {
            return node.toString().trim().replaceAll("\\s+", " ");
        } catch (RuntimeException e) {
            return "«error rendering node»";
        }
    }
}
