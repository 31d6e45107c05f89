package com.apimock.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single key/value header. Headers belong to exactly one owner, either an
 * {@link Environment} (default headers) or a {@link RouteResponse}.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Header {

    /**
     * Name of the header that marks the response content type.
     */
    public static final String CONTENT_TYPE = "Content-Type";

    private String key;

    private String value;

    /**
     * @return {@code true} if this header's key is {@code Content-Type}, ignoring case.
     */
    @JsonIgnore
    public boolean isContentType() {
        return key != null && CONTENT_TYPE.equalsIgnoreCase(key);
    }
}
