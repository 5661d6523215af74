package com.example.guard.observability.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    @Test
    @DisplayName("should propagate a well-formed correlation id")
    void shouldUseHeader() {
        MockServerHttpRequest request = MockServerHttpRequest.get("/api/v1/protection/attempts")
                .header(CorrelationIdFilter.CORRELATION_ID_HEADER, "booking-svc-42")
                .build();

        assertThat(CorrelationIdFilter.resolveCorrelationId(request)).isEqualTo("booking-svc-42");
    }

    @Test
    @DisplayName("should fall back to the request id header")
    void shouldUseRequestId() {
        MockServerHttpRequest request = MockServerHttpRequest.get("/")
                .header(CorrelationIdFilter.REQUEST_ID_HEADER, "req-7")
                .build();

        assertThat(CorrelationIdFilter.resolveCorrelationId(request)).isEqualTo("req-7");
    }

    @Test
    @DisplayName("should generate an id when the header is malformed")
    void shouldReplaceMalformedHeader() {
        MockServerHttpRequest request = MockServerHttpRequest.get("/")
                .header(CorrelationIdFilter.CORRELATION_ID_HEADER, "abc\ninjected")
                .build();

        String resolved = CorrelationIdFilter.resolveCorrelationId(request);

        assertThat(resolved).doesNotContain("injected");
        assertThat(UUID.fromString(resolved)).isNotNull();
    }
}
