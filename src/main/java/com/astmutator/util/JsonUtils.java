package com.astmutator.util;

import com.astmutator.dto.FileReportDto;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;

public class JsonUtils {
    private static final ObjectMapper mapper = new ObjectMapper();

    public static void writeReports(List<FileReportDto> reports, String path) {
        File file = new File(path);
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) {
            parent.mkdirs();
        }
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(file, reports);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write mutation report to " + path, e);
        }
    }

    public static List<FileReportDto> readReports(String path) {
        try {
            return Arrays.asList(mapper.readValue(new File(path), FileReportDto[].class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read mutation report from " + path, e);
        }
    }
}
