package com.apimock.model;

import io.swagger.models.Swagger;

import java.util.Objects;

/**
 * A dereferenced Swagger 2.0 document.
 *
 * @param document the document model produced by the Swagger 2.0 parser
 */
public record SwaggerSpecification(Swagger document) implements ParsedSpecification {

    public SwaggerSpecification {
        Objects.requireNonNull(document, "document");
    }

    @Override
    public SpecificationVersion version() {
        return SpecificationVersion.SWAGGER;
    }
}
