package com.raditha.smells.analyzer;

import com.raditha.smells.config.SmellDetectorConfig;
import com.raditha.smells.model.DuplicateBlockGroup;
import com.raditha.smells.model.DuplicateFunctionPair;
import com.raditha.smells.model.Finding;
import com.raditha.smells.model.SmellKind;
import com.raditha.smells.model.StructuralDuplicatePair;

import java.util.List;

/**
 * Everything the detectors found in one source file.
 * <p>
 * {@code findings} holds one entry per reported smell, in detector order. The raw
 * duplicate pairs and groups are kept alongside so they can be handed to the
 * refactorers without detecting again.
 */
public record SmellReport(
        String sourceName,
        List<Finding> findings,
        List<DuplicateFunctionPair> duplicateFunctions,
        List<DuplicateBlockGroup> duplicateBlocks,
        List<StructuralDuplicatePair> structuralDuplicates,
        List<DetectorError> errors,
        SmellDetectorConfig config) {

    public SmellReport {
        findings = List.copyOf(findings);
        duplicateFunctions = List.copyOf(duplicateFunctions);
        duplicateBlocks = List.copyOf(duplicateBlocks);
        structuralDuplicates = List.copyOf(structuralDuplicates);
        errors = List.copyOf(errors);
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<Finding> findingsOf(SmellKind kind) {
        return findings.stream()
                .filter(f -> f.kind() == kind)
                .toList();
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format(
                "Found %d smells in %s (%d duplicate functions, %d duplicate block groups, %d structural matches)",
                findings.size(),
                sourceName,
                duplicateFunctions.size(),
                duplicateBlocks.size(),
                structuralDuplicates.size());
    }

    /**
     * Get detailed report string.
     */
    public String getDetailedReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(80)).append("\n");
        sb.append("CODE SMELL REPORT\n");
        sb.append("=".repeat(80)).append("\n\n");

        sb.append("File: ").append(sourceName).append("\n");
        sb.append("Long method threshold: ").append(config.longMethodThreshold()).append(" lines\n");
        sb.append("Parameter threshold: ").append(config.parameterThreshold()).append("\n");
        sb.append("Block window: ").append(config.windowSize()).append(" statements at ")
                .append(String.format("%.0f%%", config.similarityThreshold() * 100)).append("\n\n");

        sb.append(getSummary()).append("\n\n");

        if (findings.isEmpty()) {
            sb.append("No code smells found.\n");
        }
        for (SmellKind kind : SmellKind.values()) {
            List<Finding> ofKind = findingsOf(kind);
            if (ofKind.isEmpty()) {
                continue;
            }
            sb.append(kind.getDisplayName()).append(" (").append(ofKind.size()).append(")\n");
            sb.append("-".repeat(80)).append("\n");
            for (Finding finding : ofKind) {
                sb.append("  ").append(finding.detail()).append("\n");
            }
            sb.append("\n");
        }

        if (!errors.isEmpty()) {
            sb.append("Detector errors:\n");
            for (DetectorError error : errors) {
                sb.append("  ").append(error.detector()).append(": ").append(error.message()).append("\n");
            }
        }
        return sb.toString();
    }

    /**
     * A detector that failed. The other detectors' results are still in the report.
     *
     * @param detector Detector name
     * @param message  Failure message
     */
    public record DetectorError(String detector, String message) {
    }
}
