package com.apimock.converter;

import com.apimock.model.HttpStatusCode;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StatusCodeFilterTest {

    @ParameterizedTest
    @ValueSource(strings = {"2XX", "4xx", "default", "abc", "", " 200", "200 ", "0200", "20", "999", "200abc"})
    void resolve_shouldRejectKeysThatAreNotSupportedCodes(String key) {
        assertThat(StatusCodeFilter.resolve(key)).isEmpty();
    }

    @Test
    void resolve_shouldAcceptSupportedCodes() {
        assertThat(StatusCodeFilter.resolve("200")).contains(HttpStatusCode.OK);
        assertThat(StatusCodeFilter.resolve("404")).contains(HttpStatusCode.NOT_FOUND);
        assertThat(StatusCodeFilter.resolve("418")).contains(HttpStatusCode.I_AM_A_TEAPOT);
    }

    @Test
    void resolve_shouldRejectNull() {
        assertThat(StatusCodeFilter.resolve(null)).isEmpty();
    }
}
