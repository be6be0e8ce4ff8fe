package com.astmutator.service;

import com.astmutator.config.MutatorProperties;
import com.astmutator.dto.FileReportDto;
import com.astmutator.dto.MutantDto;
import com.astmutator.engine.MutationEngine;
import com.astmutator.mapper.ReportMapper;
import com.astmutator.mutation.CancellationSignal;
import com.astmutator.mutation.GenerationReport;
import com.astmutator.mutation.MutationOperator;
import com.astmutator.mutation.errors.CallbackException;
import com.astmutator.mutation.errors.MutationException;
import com.astmutator.mutation.errors.OperatorException;
import com.astmutator.parser.JavaSourcePrinter;
import com.astmutator.util.DiffUtils;
import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ast.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the configured operators over one source file and records every mutant: its diff
 * against the original, optionally its source on disk, and a report entry.
 */
@Service
public class MutationReportService {
    private static final Logger log = LoggerFactory.getLogger(MutationReportService.class);

    private final MutationEngine engine;
    private final JavaSourcePrinter printer;
    private final MutantWriter mutantWriter;
    private final MutatorProperties properties;

    public MutationReportService(MutationEngine engine,
                                 JavaSourcePrinter printer,
                                 MutantWriter mutantWriter,
                                 MutatorProperties properties) {
        this.engine = engine;
        this.printer = printer;
        this.mutantWriter = mutantWriter;
        this.properties = properties;
    }

    /**
     * Mutates one file. A file that cannot be read as UTF-8 yields a report with its error set.
     */
    public FileReportDto mutateFile(Path file) throws IOException {
        String fileName = file.getFileName().toString();
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Skipping {}: cannot read file: {}", file, e.toString());
            return FileReportDto.builder()
                    .file(fileName)
                    .error("Cannot read file: " + e)
                    .build();
        }
        return mutateSource(fileName, source);
    }

    public FileReportDto mutateSource(String fileName, String source) throws IOException {
        FileReportDto report = FileReportDto.builder().file(fileName).build();

        CompilationUnit unit;
        try {
            unit = engine.parse(source);
        } catch (ParseProblemException e) {
            log.warn("Skipping {}: {}", fileName, e.getMessage());
            report.setError(e.getMessage());
            return report;
        }

        String outputDir = properties.getOutputDir();
        if (outputDir != null) {
            mutantWriter.clean(outputDir, fileName);
        }

        String original = printer.print(unit);
        List<MutationOperator> operators = engine.configuredOperators();
        List<MutantDto> mutants = new ArrayList<>();
        int limit = properties.getMaxMutations();
        CancellationSignal signal = new CancellationSignal();

        try {
            GenerationReport result = engine.mutate(unit, operators, signal, (mutation, mutatedRoot) -> {
                String mutated = printer.print(mutatedRoot);
                String diff = DiffUtils.unifiedDiff(fileName, original, mutated);
                MutantDto dto = ReportMapper.toDto(mutation, diff, DiffUtils.countChangedLines(original, mutated));
                if (outputDir != null) {
                    File written = mutantWriter.write(outputDir, fileName, mutation.getId(), mutated);
                    dto.setOutputFile(written.getPath());
                }
                mutants.add(dto);

                log.info("{} #{} {} at line {}: {} -> {}", fileName, mutation.getId(), mutation.getOperatorName(),
                        dto.getLine(), dto.getFromText(), dto.getToText());
                if (properties.isPrintDiffs() && !diff.isEmpty()) {
                    log.info("\n{}", diff);
                }
                if (limit > 0 && mutants.size() >= limit) {
                    signal.cancel();
                }
            });
            report.setDelivered(result.delivered());
            report.setCancelled(result.cancelled());
        } catch (OperatorException e) {
            log.error("Generation aborted for {}: {}", fileName, e.getMessage(), e);
            report.setDelivered(e.getDeliveredCount());
            report.setError(e.getMessage());
        } catch (CallbackException e) {
            log.error("Could not record mutant of {}: {}", fileName, e.getMessage(), e);
            report.setDelivered(e.getDeliveredCount());
            report.setError(e.getMessage());
        } catch (MutationException e) {
            log.error("Generation failed for {}: {}", fileName, e.getMessage(), e);
            report.setDelivered(mutants.size());
            report.setError(e.getMessage());
        }

        report.setMutants(mutants);
        return report;
    }
}
