package com.apimock.converter;

import com.apimock.exception.ApiMockException;
import com.apimock.model.Environment;
import com.apimock.model.Header;
import com.apimock.model.Route;
import com.apimock.model.RouteResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.swagger.v3.core.util.Json;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.Paths;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.PathParameter;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;
import io.swagger.v3.oas.models.servers.Server;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Describes a mock {@link Environment} as an OpenAPI 3.0.0 document.
 * The environment is only read, never modified.
 */
@Component
public class EnvironmentExporter {

    static final String OPENAPI_VERSION = "3.0.0";
    static final String DOCUMENT_VERSION = "1.0.0";

    /**
     * Builds the document model. Routes that resolve to the same path share one path item;
     * a later route with the same method replaces an earlier one.
     */
    public OpenAPI toOpenApi(Environment environment) {
        Paths paths = new Paths();

        for (Route route : environment.getRoutes()) {
            String pathKey = "/" + PathTranslator.toOpenApiPath(route.getEndpoint());

            Operation operation = new Operation()
                    .description(route.getDocumentation())
                    .responses(responses(environment, route));

            Set<String> parameterNames = PathTranslator.pathParameterNames(route.getEndpoint());
            if (!parameterNames.isEmpty()) {
                operation.setParameters(parameterNames.stream()
                        .map(EnvironmentExporter::pathParameter)
                        .collect(Collectors.toList()));
            }

            PathItem pathItem = paths.computeIfAbsent(pathKey, key -> new PathItem());
            pathItem.operation(PathItem.HttpMethod.valueOf(route.getMethod().name()), operation);
        }

        return new OpenAPI()
                .openapi(OPENAPI_VERSION)
                .info(new Info().title(environment.getName()).version(DOCUMENT_VERSION))
                .servers(List.of(new Server().url(serverUrl(environment))))
                .paths(paths);
    }

    /**
     * @return the document as compact JSON
     * @throws ApiMockException if the model cannot be serialized
     */
    public String serialize(OpenAPI openApi) {
        try {
            return Json.mapper().writeValueAsString(openApi);
        } catch (JsonProcessingException e) {
            throw new ApiMockException("Could not serialize OpenAPI document: " + e.getOriginalMessage(), e);
        }
    }

    public String export(Environment environment) {
        return serialize(toOpenApi(environment));
    }

    static String serverUrl(Environment environment) {
        String prefix = environment.getEndpointPrefix() != null ? environment.getEndpointPrefix() : "";
        return (environment.isHttps() ? "https" : "http") + "://localhost:" + environment.getPort() + "/" + prefix;
    }

    /**
     * Resolves the content type a response is served with: the last non-empty
     * {@code Content-Type} among the environment headers followed by the response headers.
     *
     * @return the content type, or {@code null} if none is set
     */
    static String effectiveContentType(Environment environment, RouteResponse response) {
        String contentType = null;
        for (Header header : mergedHeaders(environment, response)) {
            if (header.isContentType() && StringUtils.hasLength(header.getValue())) {
                contentType = header.getValue();
            }
        }
        return contentType;
    }

    private static ApiResponses responses(Environment environment, Route route) {
        ApiResponses responses = new ApiResponses();
        for (RouteResponse routeResponse : route.getResponses()) {
            String contentType = effectiveContentType(environment, routeResponse);
            Content content = new Content();
            if (contentType != null) {
                content.addMediaType(contentType, new MediaType());
            }

            Map<String, io.swagger.v3.oas.models.headers.Header> headers = new LinkedHashMap<>();
            for (Header header : mergedHeaders(environment, routeResponse)) {
                if (!header.isContentType()) {
                    headers.put(header.getKey(), new io.swagger.v3.oas.models.headers.Header()
                            .schema(new StringSchema())
                            .example(header.getValue()));
                }
            }

            responses.addApiResponse(String.valueOf(routeResponse.getStatusCode()), new ApiResponse()
                    .description(routeResponse.getLabel())
                    .content(content)
                    .headers(headers));
        }
        return responses;
    }

    private static List<Header> mergedHeaders(Environment environment, RouteResponse response) {
        List<Header> merged = new ArrayList<>();
        if (environment.getHeaders() != null) {
            merged.addAll(environment.getHeaders());
        }
        if (response.getHeaders() != null) {
            merged.addAll(response.getHeaders());
        }
        return merged;
    }

    private static Parameter pathParameter(String name) {
        return new PathParameter()
                .name(name)
                .schema(new StringSchema())
                .required(true);
    }
}
