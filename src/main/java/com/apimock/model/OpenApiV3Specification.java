package com.apimock.model;

import io.swagger.v3.oas.models.OpenAPI;

import java.util.Objects;

/**
 * A dereferenced OpenAPI 3.x document.
 *
 * @param document the document model produced by {@code OpenAPIV3Parser}
 */
public record OpenApiV3Specification(OpenAPI document) implements ParsedSpecification {

    public OpenApiV3Specification {
        Objects.requireNonNull(document, "document");
    }

    @Override
    public SpecificationVersion version() {
        return SpecificationVersion.OPENAPI_V3;
    }
}
