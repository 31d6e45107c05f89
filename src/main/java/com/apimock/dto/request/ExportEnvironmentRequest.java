package com.apimock.dto.request;

/**
 * Input of the {@code export-spec} command.
 *
 * @param alias  the alias of the stored environment
 * @param output the file to write, or {@code null} to print the document
 */
public record ExportEnvironmentRequest(String alias, String output) {
}
