package com.apimock.service.api;

import com.apimock.model.Environment;
import com.apimock.model.ParsedSpecification;
import java.util.Optional;

/**
 * Converts between API description documents (Swagger 2.0, OpenAPI 3.x) and mock environments.
 * <p>
 * None of these methods throws. Failures are reported through the {@link Notifier} and the
 * log, and the caller receives an empty result.
 */
public interface OpenApiConverterService {

    /**
     * Loads, dereferences and converts a Swagger 2.0 or OpenAPI 3.x document.
     *
     * @param source a local file path or an http(s) URL, JSON or YAML
     * @return the imported environment, or empty if the document is of an unrecognized
     *         version or could not be loaded
     */
    Optional<Environment> importSpecification(String source);

    /**
     * Converts a document that has already been loaded and dereferenced. Without the source
     * text, the routes of one path follow the parser's method order.
     *
     * @param specification the tagged document
     * @return the imported environment, or empty if conversion failed
     */
    Optional<Environment> importSpecification(ParsedSpecification specification);

    /**
     * Describes an environment as an OpenAPI 3.0.0 JSON document. Schema validation problems
     * are logged but do not prevent the export.
     *
     * @param environment the environment to export; it is not modified
     * @return the JSON text, or empty if the document could not be built
     */
    Optional<String> exportEnvironment(Environment environment);
}
