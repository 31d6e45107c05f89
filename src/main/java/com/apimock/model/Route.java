package com.apimock.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * One method + path endpoint of an {@link Environment}.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
public class Route {

    private String uuid;

    private Method method;

    /**
     * The path without a leading slash. Path parameters are written {@code :name}.
     */
    private String endpoint;

    private String documentation;

    /**
     * Possible responses. A route always has at least one.
     */
    private List<RouteResponse> responses = new ArrayList<>();
}
