package com.astmutator;

import com.astmutator.config.MutatorProperties;
import com.astmutator.dto.FileReportDto;
import com.astmutator.service.MutationReportService;
import com.astmutator.util.JsonUtils;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@SpringBootApplication
public class Main implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private final MutationReportService reportService;
    private final MutatorProperties properties;

    public Main(MutationReportService reportService, MutatorProperties properties) {
        this.reportService = reportService;
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication.run(Main.class, args);
    }

    @Override
    public void run(String... args) throws Exception {
        // Spring options (--astmutator.xxx=...) arrive here too
        List<String> paths = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--"))
                .collect(Collectors.toList());
        if (paths.isEmpty()) {
            log.info("Usage: ast-mutator [--astmutator.<option>=<value>...] <file-or-directory>...");
            return;
        }

        List<Path> sources = collectSources(paths);
        log.info("Mutating {} source file(s) with operators {}", sources.size(),
                properties.getOperators().isEmpty() ? "ALL" : properties.getOperators());

        Stopwatch stopwatch = Stopwatch.createStarted();
        List<FileReportDto> reports = new ArrayList<>();
        int total = 0;
        for (Path source : sources) {
            FileReportDto report;
            try {
                report = reportService.mutateFile(source);
            } catch (IOException e) {
                log.error("Failed to process {}: {}", source, e.getMessage(), e);
                report = FileReportDto.builder().error(e.toString()).build();
            }
            report.setFile(source.toString());
            reports.add(report);
            total += report.getDelivered();
        }
        log.info("Generated {} mutant(s) in {} s", total, stopwatch.elapsed(TimeUnit.SECONDS));

        if (properties.getReportFile() != null) {
            JsonUtils.writeReports(reports, properties.getReportFile());
            log.info("Report written to {}", properties.getReportFile());
        }
    }

    private List<Path> collectSources(List<String> paths) throws IOException {
        List<Path> sources = new ArrayList<>();
        for (String arg : paths) {
            Path path = Paths.get(arg);
            if (Files.isDirectory(path)) {
                try (Stream<Path> walk = Files.walk(path)) {
                    walk.filter(p -> p.toString().endsWith(".java"))
                            .filter(p -> !p.toString().contains("/test/") && !p.toString().contains("\\test\\"))
                            .sorted()
                            .forEach(sources::add);
                }
            } else if (Files.isRegularFile(path)) {
                sources.add(path);
            } else {
                log.warn("Skipping {}: not a file or directory", arg);
            }
        }
        return sources;
    }
}
