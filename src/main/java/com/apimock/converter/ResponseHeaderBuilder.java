package com.apimock.converter;

import com.apimock.model.Header;
import com.apimock.service.api.EntityFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Builds the header list of one imported response from its declared content types
 * ({@code produces} in Swagger 2.0, {@code content} keys in OpenAPI 3.x) and its
 * declared {@code headers}.
 */
@Component
public class ResponseHeaderBuilder {

    static final String DEFAULT_CONTENT_TYPE = "application/json";

    private final EntityFactory entityFactory;

    public ResponseHeaderBuilder(EntityFactory entityFactory) {
        this.entityFactory = entityFactory;
    }

    /**
     * The result always starts with a {@code Content-Type} header. It is
     * {@code application/json} unless content types are declared and none of them is JSON,
     * in which case the first declared type is used. Each declared header follows with an
     * empty value, in declaration order.
     *
     * @param contentTypes    declared content types, may be {@code null} or empty
     * @param declaredHeaders declared response headers keyed by name, may be {@code null}
     * @return a new, mutable header list owned by the caller
     */
    public List<Header> build(List<String> contentTypes, Map<String, ?> declaredHeaders) {
        Header contentType = entityFactory.newHeader(Header.CONTENT_TYPE, DEFAULT_CONTENT_TYPE);

        if (contentTypes != null && !contentTypes.isEmpty() && !contentTypes.contains(DEFAULT_CONTENT_TYPE)) {
            contentType.setValue(contentTypes.get(0));
        }

        List<Header> headers = new ArrayList<>();
        headers.add(contentType);
        if (declaredHeaders != null) {
            declaredHeaders.keySet().forEach(name -> headers.add(entityFactory.newHeader(name, "")));
        }
        return headers;
    }
}
