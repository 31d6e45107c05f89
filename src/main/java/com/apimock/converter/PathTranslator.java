package com.apimock.converter;

import com.apimock.exception.ApiMockException;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * String transforms between OpenAPI placeholders ({@code {name}}) and the mock route
 * placeholders ({@code :name}).
 * <p>
 * Inside a mock endpoint a colon always introduces a path parameter.
 */
public final class PathTranslator {

    private static final Pattern OPENAPI_PLACEHOLDER = Pattern.compile("\\{(\\w+)}");
    private static final Pattern ROUTE_PARAMETER = Pattern.compile(":([a-zA-Z0-9_]+)");
    private static final Pattern LEADING_SLASHES = Pattern.compile("^/+");

    private PathTranslator() {
    }

    /**
     * Converts an OpenAPI path such as {@code /users/{id}} to {@code /users/:id}.
     * The leading slash is kept; see {@link #removeLeadingSlash(String)}.
     */
    public static String toRoutePath(String openApiPath) {
        return OPENAPI_PLACEHOLDER.matcher(openApiPath).replaceAll(":$1");
    }

    /**
     * Replaces every {@code {name}} in a server URL template with the default value of the
     * server variable of the same name.
     *
     * @param urlTemplate      the server URL as declared, e.g. {@code https://{host}/v{major}}
     * @param variableDefaults declared default per variable name; a {@code null} value means
     *                         the variable was declared without a default
     * @return the URL with every placeholder substituted
     * @throws ApiMockException if a placeholder has no declared default
     */
    public static String substituteServerVariables(String urlTemplate, Map<String, String> variableDefaults) {
        Matcher matcher = OPENAPI_PLACEHOLDER.matcher(urlTemplate);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String variable = matcher.group(1);
            String defaultValue = variableDefaults == null ? null : variableDefaults.get(variable);
            if (defaultValue == null) {
                throw new ApiMockException("Server variable '" + variable + "' used in '" + urlTemplate
                        + "' has no default value");
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(defaultValue));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Converts a mock endpoint such as {@code users/:id} to {@code users/{id}}.
     */
    public static String toOpenApiPath(String endpoint) {
        return ROUTE_PARAMETER.matcher(endpoint).replaceAll("{$1}");
    }

    /**
     * @return the distinct path parameter names of a mock endpoint, in order of first appearance
     */
    public static Set<String> pathParameterNames(String endpoint) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = ROUTE_PARAMETER.matcher(endpoint);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    public static String removeLeadingSlash(String path) {
        return path == null ? "" : LEADING_SLASHES.matcher(path).replaceFirst("");
    }
}
