package com.apimock.service.impl;

import com.apimock.model.Environment;
import com.apimock.model.Header;
import com.apimock.model.Method;
import com.apimock.model.Route;
import com.apimock.model.RouteResponse;
import com.apimock.service.api.EntityFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Creates entities with the defaults of a freshly created mock environment. The environment
 * name and port can be changed through {@code apimock.environment.name} and
 * {@code apimock.environment.port}.
 */
@Component
public class DefaultEntityFactory implements EntityFactory {

    private final String defaultName;
    private final int defaultPort;

    public DefaultEntityFactory(@Value("${apimock.environment.name:New environment}") String defaultName,
                                @Value("${apimock.environment.port:3000}") int defaultPort) {
        this.defaultName = defaultName;
        this.defaultPort = defaultPort;
    }

    @Override
    public Environment newEnvironment() {
        Environment environment = new Environment();
        environment.setUuid(UUID.randomUUID().toString());
        environment.setName(defaultName);
        environment.setPort(defaultPort);
        environment.setEndpointPrefix("");
        environment.setHttps(false);
        environment.setHeaders(new ArrayList<>());
        environment.setRoutes(new ArrayList<>());
        return environment;
    }

    @Override
    public Route newRoute() {
        Route route = new Route();
        route.setUuid(UUID.randomUUID().toString());
        route.setMethod(Method.GET);
        route.setEndpoint("");
        route.setDocumentation("");
        List<RouteResponse> responses = new ArrayList<>();
        responses.add(newRouteResponse());
        route.setResponses(responses);
        return route;
    }

    @Override
    public RouteResponse newRouteResponse() {
        RouteResponse response = new RouteResponse();
        response.setUuid(UUID.randomUUID().toString());
        response.setStatusCode(200);
        response.setLabel("");
        response.setBody("");
        response.setHeaders(new ArrayList<>());
        return response;
    }

    @Override
    public Header newHeader(String key, String value) {
        return new Header(key, value);
    }
}
