package com.hospitality.staysync.pms;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hospitality.staysync.config.RetryConfig;
import com.hospitality.staysync.exception.MalformedPayloadException;
import com.hospitality.staysync.exception.PmsApiException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PmsApiCallExecutor.
 *
 * Tests cover:
 * - Retry budget of 10 attempts
 * - Early return on success
 * - Errors that must not be retried
 */
@ExtendWith(MockitoExtension.class)
class PmsApiCallExecutorTest {

    private static final int MAX_ATTEMPTS = 10;

    @Mock
    private PmsAdapterRegistry adapterRegistry;

    @Mock
    private PmsAdapter adapter;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SimpleMeterRegistry meterRegistry;

    private PmsApiCallExecutor callExecutor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        callExecutor = new PmsApiCallExecutor(
                adapterRegistry,
                new RetryConfig().pmsApiRetryTemplate(MAX_ATTEMPTS, 0),
                meterRegistry
        );
    }

    @Test
    @DisplayName("Should return the cleaned response on first success")
    void shouldReturnCleanedResponse() throws Exception {
        // Given
        JsonNode cleaned = objectMapper.readTree("{\"ReservationId\":\"R-1\"}");
        when(adapterRegistry.resolve("Mews")).thenReturn(Optional.of(adapter));
        when(adapter.cleanPayload("{\"ReservationId\":\"R-1\"}")).thenReturn(cleaned);

        // When
        JsonNode result = callExecutor.callWithRetry("Mews", id -> "{\"ReservationId\":\"" + id + "\"}", "R-1");

        // Then
        assertThat(result).isSameAs(cleaned);
    }

    @Test
    @DisplayName("Should stop retrying once an attempt succeeds")
    void shouldSucceedOnFourthAttempt() throws Exception {
        // Given
        JsonNode cleaned = objectMapper.readTree("{}");
        when(adapterRegistry.resolve("Mews")).thenReturn(Optional.of(adapter));
        when(adapter.cleanPayload("{}")).thenReturn(cleaned);

        AtomicInteger calls = new AtomicInteger();
        Function<String, String> flakyCall = id -> {
            if (calls.incrementAndGet() <= 3) {
                throw new PmsApiException("rate limited", "Mews", id);
            }
            return "{}";
        };

        // When
        JsonNode result = callExecutor.callWithRetry("Mews", flakyCall, "R-1");

        // Then
        assertThat(result).isSameAs(cleaned);
        assertThat(calls.get()).isEqualTo(4);
        verify(adapter, times(1)).cleanPayload(anyString());
        assertThat(meterRegistry.counter("pms.api.errors").count()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should give up with a PMS API error after 10 failed attempts")
    void shouldGiveUpAfterTenAttempts() {
        // Given
        when(adapterRegistry.resolve("Mews")).thenReturn(Optional.of(adapter));

        AtomicInteger calls = new AtomicInteger();
        Function<String, String> deadCall = id -> {
            calls.incrementAndGet();
            throw new PmsApiException("unavailable", "Mews", id);
        };

        // When / Then
        assertThatThrownBy(() -> callExecutor.callWithRetry("Mews", deadCall, "R-1"))
                .isInstanceOf(PmsApiException.class)
                .hasMessageContaining("10 attempts")
                .satisfies(e -> assertThat(((PmsApiException) e).isRetryable()).isFalse());

        assertThat(calls.get()).isEqualTo(MAX_ATTEMPTS);
        verify(adapter, never()).cleanPayload(any());
        assertThat(meterRegistry.counter("pms.api.exhausted").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should not retry a PMS API error marked as non-retryable")
    void shouldNotRetryNonRetryableError() {
        // Given
        when(adapterRegistry.resolve("Mews")).thenReturn(Optional.of(adapter));

        AtomicInteger calls = new AtomicInteger();
        Function<String, String> refusedCall = id -> {
            calls.incrementAndGet();
            throw new PmsApiException("invalid credentials", "Mews", id, false);
        };

        // When / Then
        assertThatThrownBy(() -> callExecutor.callWithRetry("Mews", refusedCall, "R-1"))
                .isInstanceOf(PmsApiException.class)
                .hasMessage("invalid credentials");

        assertThat(calls.get()).isEqualTo(1);
        assertThat(meterRegistry.counter("pms.api.exhausted").count()).isZero();
    }

    @Test
    @DisplayName("Should not retry a response that cannot be cleaned")
    void shouldNotRetryMalformedResponse() {
        // Given
        when(adapterRegistry.resolve("Mews")).thenReturn(Optional.of(adapter));
        when(adapter.cleanPayload("not json")).thenThrow(new MalformedPayloadException("not JSON"));

        AtomicInteger calls = new AtomicInteger();

        // When / Then
        assertThatThrownBy(() -> callExecutor.callWithRetry("Mews", id -> {
            calls.incrementAndGet();
            return "not json";
        }, "R-1"))
                .isInstanceOf(MalformedPayloadException.class);

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fail fast when no adapter is registered for the vendor")
    void shouldFailForUnknownVendor() {
        // Given
        when(adapterRegistry.resolve("Opera")).thenReturn(Optional.empty());
        AtomicInteger calls = new AtomicInteger();

        // When / Then
        assertThatThrownBy(() -> callExecutor.callWithRetry("Opera", id -> {
            calls.incrementAndGet();
            return "{}";
        }, "R-1"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Opera");

        assertThat(calls.get()).isZero();
    }
}
