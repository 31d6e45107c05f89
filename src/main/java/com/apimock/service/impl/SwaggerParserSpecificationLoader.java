package com.apimock.service.impl;

import com.apimock.exception.ApiMockException;
import com.apimock.model.OpenApiV3Specification;
import com.apimock.model.ParsedSpecification;
import com.apimock.model.SpecificationVersion;
import com.apimock.model.SwaggerSpecification;
import com.apimock.service.api.SpecificationLoader;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.swagger.models.Swagger;
import io.swagger.parser.SwaggerParser;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Loads specifications with the swagger-parser libraries: {@link OpenAPIV3Parser} for OpenAPI 3.x
 * and the Swagger 2.0 {@link SwaggerParser}. Both are asked to resolve every {@code $ref}, so the
 * converter only ever sees inline objects.
 */
@Slf4j
@Service
public class SwaggerParserSpecificationLoader implements SpecificationLoader {

    // The YAML factory also reads JSON documents.
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    @Override
    public JsonNode readTree(String source) {
        try (InputStream input = open(source)) {
            JsonNode root = yamlMapper.readTree(input);
            if (root == null || root.isMissingNode()) {
                throw new ApiMockException("The document at '" + source + "' is empty");
            }
            return root;
        } catch (ApiMockException e) {
            throw e;
        } catch (Exception e) {
            log.error("Could not read specification from {}", source, e);
            throw new ApiMockException("Could not read '" + source + "': " + e.getMessage(), e);
        }
    }

    @Override
    public ParsedSpecification dereference(String source, SpecificationVersion version) {
        switch (version) {
            case SWAGGER:
                return new SwaggerSpecification(readSwagger(source));
            case OPENAPI_V3:
                return new OpenApiV3Specification(readOpenApiV3(source));
            default:
                throw new ApiMockException("Cannot dereference a document of version " + version);
        }
    }

    private Swagger readSwagger(String source) {
        Swagger swagger = new SwaggerParser().read(location(source), null, true);
        if (swagger == null) {
            throw new ApiMockException("'" + source + "' is not a valid Swagger 2.0 specification");
        }
        return swagger;
    }

    private io.swagger.v3.oas.models.OpenAPI readOpenApiV3(String source) {
        ParseOptions options = new ParseOptions();
        options.setResolve(true);
        options.setResolveFully(true);

        SwaggerParseResult result = new OpenAPIV3Parser().readLocation(location(source), null, options);
        if (result == null) {
            throw new ApiMockException("The OpenAPI parser returned no result for '" + source + "'");
        }
        if (result.getMessages() != null) {
            result.getMessages().forEach(message -> log.warn("OpenAPI parser message for {}: {}", source, message));
        }
        if (result.getOpenAPI() == null) {
            String details = result.getMessages() != null && !result.getMessages().isEmpty()
                    ? String.join("; ", result.getMessages())
                    : "no details available";
            throw new ApiMockException("'" + source + "' is not a valid OpenAPI 3 specification: " + details);
        }
        return result.getOpenAPI();
    }

    private static InputStream open(String source) throws Exception {
        if (isUrl(source)) {
            return URI.create(source).toURL().openStream();
        }
        Path path = Paths.get(source);
        if (!Files.isRegularFile(path)) {
            throw new ApiMockException("Specification file not found: " + source);
        }
        return Files.newInputStream(path);
    }

    // Parsers resolve relative references against the location, so local files are passed absolute.
    private static String location(String source) {
        return isUrl(source) ? source : Paths.get(source).toAbsolutePath().toString();
    }

    private static boolean isUrl(String source) {
        String lower = source.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }
}
