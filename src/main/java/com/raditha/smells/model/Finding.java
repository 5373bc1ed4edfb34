package com.raditha.smells.model;

/**
 * A single smell detected in a source file.
 *
 * @param kind    What was detected
 * @param subject Name of the function (or first function of a group) the finding is about
 * @param metric  Measured value: line count, parameter count, group size or similarity percent
 * @param detail  Human readable description
 */
public record Finding(
        SmellKind kind,
        String subject,
        int metric,
        String detail) {
}
