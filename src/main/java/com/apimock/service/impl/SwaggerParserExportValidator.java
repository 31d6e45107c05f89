package com.apimock.service.impl;

import com.apimock.service.api.ExportValidator;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Validates exported documents by reading them back with {@link OpenAPIV3Parser}, which
 * reports schema violations as messages instead of throwing.
 */
@Slf4j
@Component
public class SwaggerParserExportValidator implements ExportValidator {

    @Override
    public List<String> validate(String openApiJson) {
        try {
            ParseOptions options = new ParseOptions();
            options.setResolve(false);
            SwaggerParseResult result = new OpenAPIV3Parser().readContents(openApiJson, null, options);
            if (result == null) {
                return List.of("The OpenAPI parser returned no result");
            }
            if (result.getOpenAPI() == null && (result.getMessages() == null || result.getMessages().isEmpty())) {
                return List.of("The exported document could not be read back as OpenAPI");
            }
            return result.getMessages() != null ? result.getMessages() : Collections.emptyList();
        } catch (Exception e) {
            log.debug("OpenAPI validator failed", e);
            return List.of("Validator failure: " + e.getMessage());
        }
    }
}
