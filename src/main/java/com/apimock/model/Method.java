package com.apimock.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The HTTP methods a mock route can answer. Any other method found in an imported
 * document is dropped.
 */
public enum Method {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    OPTIONS;

    /**
     * Looks up a method by name, ignoring case.
     *
     * @param name the method name as declared in a document, e.g. {@code "get"} or {@code "GET"}
     * @return the matching method, or an empty Optional if the name is not whitelisted
     */
    public static Optional<Method> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(method -> method.name().equalsIgnoreCase(name))
                .findFirst();
    }

    @JsonCreator
    public static Method fromJson(String name) {
        return fromName(name).orElseThrow(() -> new IllegalArgumentException("Unsupported HTTP method: " + name));
    }

    /**
     * @return the lower-case form used in stored environments and OpenAPI path items
     */
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
