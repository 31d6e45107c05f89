package com.apimock.dto.request;

/**
 * Input of the {@code import-spec} command.
 *
 * @param alias  the alias the imported environment is stored under
 * @param source the file path or URL of the Swagger/OpenAPI document
 */
public record ImportSpecRequest(String alias, String source) {
}
