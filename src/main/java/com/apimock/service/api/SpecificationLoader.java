package com.apimock.service.api;

import com.apimock.model.ParsedSpecification;
import com.apimock.model.SpecificationVersion;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Loads API descriptions from a file path or URL.
 */
public interface SpecificationLoader {

    /**
     * Reads the document as a plain tree, without resolving references. Used to detect
     * the format before choosing a parser.
     *
     * @param source a local file path or an http(s) URL; JSON or YAML
     * @return the document root
     * @throws com.apimock.exception.ApiMockException if the source cannot be read or parsed
     */
    JsonNode readTree(String source);

    /**
     * Parses the document with the parser for {@code version} and resolves all references.
     *
     * @param source  the same source passed to {@link #readTree(String)}
     * @param version {@link SpecificationVersion#SWAGGER} or {@link SpecificationVersion#OPENAPI_V3}
     * @return the dereferenced document
     * @throws com.apimock.exception.ApiMockException if parsing fails or the version is unsupported
     */
    ParsedSpecification dereference(String source, SpecificationVersion version);
}
