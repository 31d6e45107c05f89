package com.apimock.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * A response a {@link Route} can serve.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
public class RouteResponse {

    private String uuid;

    /**
     * One of the codes listed in {@link HttpStatusCode}.
     */
    private int statusCode;

    private String label;

    /**
     * The body template. Conversion never fills it in.
     */
    private String body;

    private List<Header> headers = new ArrayList<>();
}
