package com.astmutator.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileReportDto {
    private String file;
    private int delivered;
    private boolean cancelled;
    /** Set when the file could not be parsed or generation failed part way. */
    private String error;
    @Builder.Default
    private List<MutantDto> mutants = new ArrayList<>();
}
