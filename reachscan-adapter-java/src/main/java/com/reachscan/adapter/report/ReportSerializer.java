package com.reachscan.adapter.report;

import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;

/**
 * Sorts and serializes a ReportRoot to reachability.json.
 * Produces deterministic output by sorting all arrays before writing.
 */
public class ReportSerializer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportSerializer.class);

    public static final String REPORT_FILE = "reachability.json";
    public static final String METADATA_FILE = "metadata.json";

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code root} to {@code outputDir/reachability.json} with arrays sorted for determinism.
     * Also writes {@code outputDir/metadata.json} with the project name and timestamp.
     *
     * @param root        report to write
     * @param outputDir   directory to write into (created if absent)
     * @param projectName name for metadata.json
     * @return path of the written report
     */
    public Path write(ReportModel.ReportRoot root, Path outputDir, String projectName) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }

        sort(root);
        var gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

        Path reportPath = outputDir.resolve(REPORT_FILE);
        try (Writer w = Files.newBufferedWriter(reportPath, StandardCharsets.UTF_8)) {
            gson.toJson(root, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + REPORT_FILE + ": " + e.getMessage(), e);
        }
        LOGGER.info("{} written: {}", REPORT_FILE, reportPath);

        var meta = new Metadata(projectName, "java", ReportModel.REPORT_VERSION, Instant.now().toString());
        Path metaPath = outputDir.resolve(METADATA_FILE);
        try (Writer w = Files.newBufferedWriter(metaPath, StandardCharsets.UTF_8)) {
            gson.toJson(meta, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + METADATA_FILE + ": " + e.getMessage(), e);
        }
        LOGGER.debug("{} written: {}", METADATA_FILE, metaPath);
        return reportPath;
    }

    /** Sorts every array of {@code root} in place (after copying to mutable lists). */
    void sort(ReportModel.ReportRoot root) {
        if (root.entryPoints != null) {
            root.entryPoints = new ArrayList<>(root.entryPoints);
            root.entryPoints.sort(Comparator.comparing(e -> e.function));
        }
        if (root.units != null) {
            root.units = new ArrayList<>(root.units);
            root.units.sort(Comparator.comparing(u -> u.path));
        }
        if (root.functions != null) {
            root.functions = new ArrayList<>(root.functions);
            root.functions.sort(Comparator.comparing(f -> f.id));
        }
        if (root.blocks != null) {
            root.blocks = new ArrayList<>(root.blocks);
            root.blocks.sort(Comparator.comparing((ReportModel.ReportBlock b) -> b.function)
                    .thenComparingInt(b -> blockIndex(b.block)));
        }
        if (root.unresolvedCalls != null) {
            root.unresolvedCalls = new ArrayList<>(root.unresolvedCalls);
            root.unresolvedCalls.sort(Comparator.comparing((ReportModel.ReportCall c) -> c.caller)
                    .thenComparingInt(c -> blockIndex(c.block))
                    .thenComparing(c -> c.target));
        }
    }

    /** Numeric part of a block id such as {@code b12}, so b2 sorts before b10. */
    static int blockIndex(String blockId) {
        if (blockId == null || !blockId.matches("b\\d{1,9}")) {
            return Integer.MAX_VALUE;
        }
        return Integer.parseInt(blockId.substring(1));
    }

    private record Metadata(
            String projectName,
            String language,
            String reportVersion,
            String timestamp
    ) {}
}
