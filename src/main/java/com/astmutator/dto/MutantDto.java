package com.astmutator.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MutantDto {
    private int id;
    private String operator;
    private String location;
    private Integer line;
    private Integer column;
    private String fromText;
    private String toText;
    private int changedLines;
    private String diff;
    private String outputFile;
}
