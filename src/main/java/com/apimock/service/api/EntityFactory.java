package com.apimock.service.api;

import com.apimock.model.Environment;
import com.apimock.model.Header;
import com.apimock.model.Route;
import com.apimock.model.RouteResponse;

/**
 * The single source of default values for mock entities. Converters only override
 * fields on what this factory returns.
 */
public interface EntityFactory {

    /**
     * @return a new environment with default name, port and prefix, and no routes
     */
    Environment newEnvironment();

    /**
     * @return a new {@code get} route on an empty endpoint with one default response
     */
    Route newRoute();

    /**
     * @return a new {@code 200} response with empty label, body and headers
     */
    RouteResponse newRouteResponse();

    Header newHeader(String key, String value);
}
