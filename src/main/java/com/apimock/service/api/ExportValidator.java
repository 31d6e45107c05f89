package com.apimock.service.api;

import java.util.List;

/**
 * Checks an exported document against the OpenAPI 3.0 schema.
 */
public interface ExportValidator {

    /**
     * @param openApiJson the serialized document
     * @return the validation messages; empty if the document is valid
     */
    List<String> validate(String openApiJson);
}
