package com.astmutator.service;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Persists mutant sources as {@code <outputDir>/<FileBaseName>/<id>/<FileName>}, so every
 * mutant keeps the original file name and can be compiled on its own.
 */
@Service
public class MutantWriter {

    public File write(String outputDir, String fileName, int mutationId, String source) throws IOException {
        File target = new File(new File(new File(outputDir, FilenameUtils.getBaseName(fileName)),
                String.valueOf(mutationId)), fileName);
        FileUtils.writeStringToFile(target, source, StandardCharsets.UTF_8);
        return target;
    }

    public void clean(String outputDir, String fileName) throws IOException {
        File dir = new File(outputDir, FilenameUtils.getBaseName(fileName));
        if (dir.exists()) {
            FileUtils.deleteDirectory(dir);
        }
    }
}
