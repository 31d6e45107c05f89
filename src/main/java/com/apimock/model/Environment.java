package com.apimock.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * A mock-server configuration: where it listens, which default headers it sends and
 * which routes it serves.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
public class Environment {

    /**
     * A unique identifier assigned when the environment is created.
     */
    private String uuid;

    /**
     * The display name, taken from {@code info.title} on import.
     */
    private String name;

    /**
     * The port the mock server listens on.
     */
    private int port;

    /**
     * The base path every route is served under. Never starts with a slash.
     */
    private String endpointPrefix;

    /**
     * Whether the mock server is served over TLS.
     */
    private boolean https;

    /**
     * Headers added to every response of this environment.
     */
    private List<Header> headers = new ArrayList<>();

    /**
     * The routes, in declaration order of the imported document.
     */
    private List<Route> routes = new ArrayList<>();
}
