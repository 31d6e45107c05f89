package com.apimock.exception;

/**
 * User-facing texts for import and export failures.
 */
public enum ErrorMessage {
    IMPORT_WRONG_VERSION("Imported file is not a Swagger 2.0 or OpenAPI 3.x specification"),
    IMPORT_ERROR("Error while importing file"),
    EXPORT_ERROR("Error while exporting environment");

    private final String text;

    ErrorMessage(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    /**
     * @return this message followed by {@code ": "} and the detail
     */
    public String withDetail(String detail) {
        return text + ": " + detail;
    }
}
