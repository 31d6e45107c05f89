package com.apimock.converter;

import com.apimock.exception.ApiMockException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathTranslatorTest {

    @Test
    void toRoutePath_shouldReplaceEveryPlaceholder() {
        assertThat(PathTranslator.toRoutePath("/users/{id}/orders/{orderId}"))
                .isEqualTo("/users/:id/orders/:orderId");
        assertThat(PathTranslator.toRoutePath("/health")).isEqualTo("/health");
    }

    @Test
    void toOpenApiPath_shouldReplaceEveryRouteParameter() {
        assertThat(PathTranslator.toOpenApiPath("users/:id/orders/:order_Id2"))
                .isEqualTo("users/{id}/orders/{order_Id2}");
    }

    @Test
    void pathParameterNames_shouldBeDistinctAndOrdered() {
        assertThat(PathTranslator.pathParameterNames("a/:first/b/:second/c/:first"))
                .containsExactly("first", "second");
        assertThat(PathTranslator.pathParameterNames("no/parameters")).isEmpty();
    }

    @Test
    void substituteServerVariables_shouldUseDeclaredDefaults() {
        Map<String, String> defaults = Map.of("scheme", "https", "basePath", "api/v1");

        assertThat(PathTranslator.substituteServerVariables("{scheme}://example.com/{basePath}", defaults))
                .isEqualTo("https://example.com/api/v1");
    }

    @Test
    void substituteServerVariables_shouldKeepDollarSignsLiteral() {
        assertThat(PathTranslator.substituteServerVariables("/{version}", Map.of("version", "$1")))
                .isEqualTo("/$1");
    }

    @Test
    void substituteServerVariables_shouldFailWhenDefaultIsMissing() {
        Map<String, String> defaults = new HashMap<>();
        defaults.put("region", null);

        assertThatThrownBy(() -> PathTranslator.substituteServerVariables("https://{region}.example.com", defaults))
                .isInstanceOf(ApiMockException.class)
                .hasMessageContaining("region");
        assertThatThrownBy(() -> PathTranslator.substituteServerVariables("https://{undeclared}.example.com", Map.of()))
                .isInstanceOf(ApiMockException.class)
                .hasMessageContaining("undeclared");
    }

    @Test
    void removeLeadingSlash_shouldHandleNullAndRepeatedSlashes() {
        assertThat(PathTranslator.removeLeadingSlash("/v2")).isEqualTo("v2");
        assertThat(PathTranslator.removeLeadingSlash("//v2/x")).isEqualTo("v2/x");
        assertThat(PathTranslator.removeLeadingSlash("v2")).isEqualTo("v2");
        assertThat(PathTranslator.removeLeadingSlash(null)).isEmpty();
    }
}
