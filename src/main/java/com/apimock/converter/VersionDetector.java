package com.apimock.converter;

import com.apimock.model.SpecificationVersion;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Classifies a raw document tree as Swagger 2.0 or OpenAPI 3.x.
 */
public final class VersionDetector {

    private VersionDetector() {
    }

    public static SpecificationVersion detect(JsonNode document) {
        if (document == null || !document.isObject()) {
            return SpecificationVersion.UNRECOGNIZED;
        }
        if (document.has("swagger")) {
            return SpecificationVersion.SWAGGER;
        }
        JsonNode openapi = document.get("openapi");
        if (openapi != null && openapi.isTextual() && openapi.asText().startsWith("3.")) {
            return SpecificationVersion.OPENAPI_V3;
        }
        return SpecificationVersion.UNRECOGNIZED;
    }
}
