package com.apimock.converter;

import com.apimock.model.HttpStatusCode;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides which declared response keys can become mock responses.
 */
public final class StatusCodeFilter {

    private static final Pattern NUMERIC_KEY = Pattern.compile("\\d{3}");

    private StatusCodeFilter() {
    }

    /**
     * Resolves a response key of an OpenAPI or Swagger {@code responses} object.
     *
     * @param responseKey the key as declared, e.g. {@code "200"}, {@code "4XX"} or {@code "default"}
     * @return the status code, or an empty Optional if the key is not exactly one of the
     *         supported codes
     */
    public static Optional<HttpStatusCode> resolve(String responseKey) {
        if (responseKey == null || !NUMERIC_KEY.matcher(responseKey).matches()) {
            return Optional.empty();
        }
        return HttpStatusCode.fromCode(Integer.parseInt(responseKey));
    }
}
