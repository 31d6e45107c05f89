package com.apimock.converter;

import com.apimock.model.Environment;
import com.apimock.model.Header;
import com.apimock.model.HttpStatusCode;
import com.apimock.model.Method;
import com.apimock.model.OpenApiV3Specification;
import com.apimock.model.ParsedSpecification;
import com.apimock.model.Route;
import com.apimock.model.RouteResponse;
import com.apimock.model.SwaggerSpecification;
import com.apimock.service.api.EntityFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.swagger.models.Swagger;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.servers.ServerVariable;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Builds a mock {@link Environment} from a dereferenced Swagger 2.0 or OpenAPI 3.x document.
 * <p>
 * Both formats go through the same route construction. The format-specific helpers only
 * flatten each operation into an {@link ImportedOperation}; everything after that
 * (method whitelisting, status filtering, header building, the default response) is shared.
 */
@Slf4j
@Component
public class EnvironmentImporter {

    static final String SWAGGER_DEFAULT_NAME = "Swagger import";
    static final String OPENAPI_DEFAULT_NAME = "OpenAPI import";

    private static final Pattern HOST_PORT = Pattern.compile("^[^:]*:(\\d+)");

    private final EntityFactory entityFactory;
    private final ResponseHeaderBuilder responseHeaderBuilder;

    public EnvironmentImporter(EntityFactory entityFactory, ResponseHeaderBuilder responseHeaderBuilder) {
        this.entityFactory = entityFactory;
        this.responseHeaderBuilder = responseHeaderBuilder;
    }

    /**
     * Converts a dereferenced document without its source text. The parsers do not keep the
     * declaration order of the methods within a path, so those routes come out in the
     * parser's fixed method order.
     *
     * @see #convert(ParsedSpecification, JsonNode)
     */
    public Environment convert(ParsedSpecification specification) {
        return convert(specification, null);
    }

    /**
     * Converts a dereferenced document.
     *
     * @param specification  the tagged document
     * @param sourceDocument the raw tree the document was parsed from, or {@code null}; its
     *                       {@code paths} entries give the declaration order of the methods
     * @return a new environment; its routes follow the declaration order of the document
     * @throws com.apimock.exception.ApiMockException if a server URL uses a variable without default
     */
    public Environment convert(ParsedSpecification specification, JsonNode sourceDocument) {
        JsonNode declaredPaths = sourceDocument == null ? MissingNode.getInstance() : sourceDocument.path("paths");
        switch (specification.version()) {
            case SWAGGER:
                return fromSwagger(((SwaggerSpecification) specification).document(), declaredPaths);
            case OPENAPI_V3:
                return fromOpenApiV3(((OpenApiV3Specification) specification).document(), declaredPaths);
            default:
                throw new IllegalArgumentException("Cannot convert a document of version " + specification.version());
        }
    }

    private Environment fromSwagger(Swagger document, JsonNode declaredPaths) {
        Environment environment = entityFactory.newEnvironment();

        environment.setPort(parsePort(document.getHost(), environment.getPort()));

        if (StringUtils.hasLength(document.getBasePath())) {
            environment.setEndpointPrefix(PathTranslator.removeLeadingSlash(document.getBasePath()));
        }

        String title = document.getInfo() != null ? document.getInfo().getTitle() : null;
        environment.setName(StringUtils.hasLength(title) ? title : SWAGGER_DEFAULT_NAME);

        environment.setRoutes(createRoutes(swaggerOperations(document, declaredPaths)));
        return environment;
    }

    private Environment fromOpenApiV3(OpenAPI document, JsonNode declaredPaths) {
        Environment environment = entityFactory.newEnvironment();

        Server server = document.getServers() != null && !document.getServers().isEmpty()
                ? document.getServers().get(0)
                : null;
        if (server != null && StringUtils.hasLength(server.getUrl())) {
            String url = PathTranslator.substituteServerVariables(server.getUrl(), variableDefaults(server));
            String path = serverPath(url);
            if (path != null) {
                environment.setEndpointPrefix(PathTranslator.removeLeadingSlash(path));
            }
        }

        String title = document.getInfo() != null ? document.getInfo().getTitle() : null;
        environment.setName(StringUtils.hasLength(title) ? title : OPENAPI_DEFAULT_NAME);

        environment.setRoutes(createRoutes(openApiOperations(document, declaredPaths)));
        return environment;
    }

    /**
     * @return the numeric port of a {@code hostname:port} host, or {@code defaultPort}
     */
    static int parsePort(String host, int defaultPort) {
        if (host == null) {
            return defaultPort;
        }
        Matcher matcher = HOST_PORT.matcher(host);
        if (!matcher.find()) {
            return defaultPort;
        }
        try {
            int port = Integer.parseInt(matcher.group(1));
            return port > 0 ? port : defaultPort;
        } catch (NumberFormatException e) {
            log.debug("Ignoring out of range port in host '{}'", host);
            return defaultPort;
        }
    }

    /**
     * @return the path of a server URL, or {@code null} if the URL is not a valid URI
     */
    static String serverPath(String url) {
        try {
            return new URI(url).getPath();
        } catch (URISyntaxException e) {
            log.warn("Ignoring server URL '{}' for the endpoint prefix: {}", url, e.getMessage());
            return null;
        }
    }

    private static Map<String, String> variableDefaults(Server server) {
        if (server.getVariables() == null) {
            return Collections.emptyMap();
        }
        Map<String, String> defaults = new LinkedHashMap<>();
        for (Map.Entry<String, ServerVariable> variable : server.getVariables().entrySet()) {
            defaults.put(variable.getKey(), variable.getValue() == null ? null : variable.getValue().getDefault());
        }
        return defaults;
    }

    // --- Format-specific flattening ---

    private static List<ImportedOperation> swaggerOperations(Swagger document, JsonNode declaredPaths) {
        List<ImportedOperation> operations = new ArrayList<>();
        if (document.getPaths() == null) {
            return operations;
        }
        document.getPaths().forEach((path, pathItem) -> {
            if (pathItem == null || pathItem.getOperationMap() == null) {
                return;
            }
            List<ImportedOperation> pathOperations = new ArrayList<>();
            pathItem.getOperationMap().forEach((method, operation) -> {
                List<String> produces = operation.getProduces();
                List<ImportedResponse> responses = new ArrayList<>();
                if (operation.getResponses() != null) {
                    operation.getResponses().forEach((status, response) -> responses.add(new ImportedResponse(
                            status,
                            response == null ? null : response.getDescription(),
                            produces,
                            response == null ? null : response.getHeaders())));
                }
                pathOperations.add(new ImportedOperation(path, method.name(), operation.getSummary(),
                        operation.getDescription(), responses));
            });
            operations.addAll(inDeclarationOrder(pathOperations, declaredPaths.path(path)));
        });
        return operations;
    }

    private static List<ImportedOperation> openApiOperations(OpenAPI document, JsonNode declaredPaths) {
        List<ImportedOperation> operations = new ArrayList<>();
        if (document.getPaths() == null) {
            return operations;
        }
        document.getPaths().forEach((path, pathItem) -> {
            if (pathItem == null) {
                return;
            }
            List<ImportedOperation> pathOperations = new ArrayList<>();
            pathItem.readOperationsMap().forEach((method, operation) -> {
                List<ImportedResponse> responses = new ArrayList<>();
                if (operation.getResponses() != null) {
                    operation.getResponses().forEach((status, response) -> responses.add(new ImportedResponse(
                            status,
                            response == null ? null : response.getDescription(),
                            contentTypes(response),
                            response == null ? null : response.getHeaders())));
                }
                pathOperations.add(new ImportedOperation(path, method.name(), operation.getSummary(),
                        operation.getDescription(), responses));
            });
            operations.addAll(inDeclarationOrder(pathOperations, declaredPaths.path(path)));
        });
        return operations;
    }

    /**
     * Sorts the operations of one path by the position of their method key in the raw path
     * item. Methods missing from the raw tree keep the parser's order, after the others.
     */
    private static List<ImportedOperation> inDeclarationOrder(List<ImportedOperation> operations,
                                                              JsonNode declaredPathItem) {
        if (!declaredPathItem.isObject()) {
            return operations;
        }
        List<String> declaredMethods = new ArrayList<>();
        declaredPathItem.fieldNames().forEachRemaining(name -> declaredMethods.add(name.toLowerCase(Locale.ROOT)));
        operations.sort(Comparator.comparingInt(operation -> {
            int index = declaredMethods.indexOf(operation.method().toLowerCase(Locale.ROOT));
            return index < 0 ? Integer.MAX_VALUE : index;
        }));
        return operations;
    }

    private static List<String> contentTypes(ApiResponse response) {
        if (response == null || response.getContent() == null) {
            return Collections.emptyList();
        }
        return new ArrayList<>(response.getContent().keySet());
    }

    // --- Shared route construction ---

    private List<Route> createRoutes(List<ImportedOperation> operations) {
        List<Route> routes = new ArrayList<>();
        for (ImportedOperation operation : operations) {
            Optional<Method> method = Method.fromName(operation.method());
            if (method.isEmpty()) {
                log.debug("Skipping unsupported method {} on path {}", operation.method(), operation.path());
                continue;
            }
            routes.add(createRoute(operation, method.get()));
        }
        return routes;
    }

    private Route createRoute(ImportedOperation operation, Method method) {
        List<RouteResponse> routeResponses = new ArrayList<>();

        for (ImportedResponse response : operation.responses()) {
            Optional<HttpStatusCode> statusCode = StatusCodeFilter.resolve(response.status());
            if (statusCode.isEmpty()) {
                log.debug("Skipping unsupported status '{}' of {} {}", response.status(), method.value(), operation.path());
                continue;
            }
            RouteResponse routeResponse = entityFactory.newRouteResponse();
            routeResponse.setBody("");
            routeResponse.setStatusCode(statusCode.get().getCode());
            routeResponse.setLabel(response.description() != null ? response.description() : "");
            routeResponse.setHeaders(responseHeaderBuilder.build(response.contentTypes(), response.headers()));
            routeResponses.add(routeResponse);
        }

        if (routeResponses.isEmpty()) {
            RouteResponse fallback = entityFactory.newRouteResponse();
            List<Header> headers = new ArrayList<>();
            headers.add(entityFactory.newHeader(Header.CONTENT_TYPE, ResponseHeaderBuilder.DEFAULT_CONTENT_TYPE));
            fallback.setHeaders(headers);
            routeResponses.add(fallback);
        }

        Route route = entityFactory.newRoute();
        route.setDocumentation(documentation(operation));
        route.setMethod(method);
        route.setEndpoint(PathTranslator.removeLeadingSlash(PathTranslator.toRoutePath(operation.path())));
        route.setResponses(routeResponses);
        return route;
    }

    private static String documentation(ImportedOperation operation) {
        if (StringUtils.hasLength(operation.summary())) {
            return operation.summary();
        }
        return StringUtils.hasLength(operation.description()) ? operation.description() : "";
    }

    private record ImportedOperation(String path, String method, String summary, String description,
                                     List<ImportedResponse> responses) {
    }

    private record ImportedResponse(String status, String description, List<String> contentTypes,
                                    Map<String, ?> headers) {
    }
}
