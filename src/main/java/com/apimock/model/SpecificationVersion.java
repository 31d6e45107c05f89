package com.apimock.model;

/**
 * Classification of an imported document.
 */
public enum SpecificationVersion {
    /**
     * Swagger 2.0, recognized by a top-level {@code swagger} field.
     */
    SWAGGER,
    /**
     * OpenAPI 3.x, recognized by a top-level {@code openapi} string starting with {@code "3."}.
     */
    OPENAPI_V3,
    /**
     * Anything else. Such documents are never converted.
     */
    UNRECOGNIZED
}
