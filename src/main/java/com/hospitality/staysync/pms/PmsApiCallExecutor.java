package com.hospitality.staysync.pms;

import com.fasterxml.jackson.databind.JsonNode;
import com.hospitality.staysync.exception.PmsApiException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.function.Function;

/**
 * Calls a vendor API and cleans its response, retrying while the vendor
 * reports itself unavailable.
 * <p>
 * Only a retryable {@link PmsApiException} is retried, up to the attempt budget
 * of the injected template. Cleaning errors and non-retryable vendor errors are
 * not retried and surface unchanged. When the budget is spent
 * the call fails with a non-retryable {@link PmsApiException}; it is up to the
 * caller to abort its batch.
 */
@Component
@Slf4j
public class PmsApiCallExecutor {

    private final PmsAdapterRegistry adapterRegistry;
    private final RetryTemplate retryTemplate;
    private final Counter apiErrorCounter;
    private final Counter exhaustedCounter;

    public PmsApiCallExecutor(PmsAdapterRegistry adapterRegistry,
                              RetryTemplate pmsApiRetryTemplate,
                              MeterRegistry meterRegistry) {
        this.adapterRegistry = adapterRegistry;
        this.retryTemplate = pmsApiRetryTemplate;

        this.apiErrorCounter = Counter.builder("pms.api.errors")
                .description("Failed PMS API attempts")
                .register(meterRegistry);

        this.exhaustedCounter = Counter.builder("pms.api.exhausted")
                .description("PMS API calls that failed on every attempt")
                .register(meterRegistry);
    }

    /**
     * @param pmsName    vendor whose adapter cleans the response
     * @param remoteCall the vendor API call, returning the raw body
     * @param params     argument for the call
     * @return the cleaned response
     * @throws IllegalStateException if no adapter is registered for {@code pmsName}
     * @throws PmsApiException       if every attempt failed
     */
    public <P> JsonNode callWithRetry(String pmsName, Function<P, String> remoteCall, P params) {
        PmsAdapter adapter = adapterRegistry.resolve(pmsName)
                .orElseThrow(() -> new IllegalStateException("No PMS adapter registered for " + pmsName));

        return retryTemplate.execute(context -> {
            try {
                String raw = remoteCall.apply(params);
                return adapter.cleanPayload(raw);
            } catch (PmsApiException e) {
                apiErrorCounter.increment();
                log.warn("{} API call for {} failed on attempt {}: {}",
                        pmsName, params, context.getRetryCount() + 1, e.getMessage());
                if (!e.isRetryable()) {
                    context.setExhaustedOnly();
                }
                throw e;
            }
        }, context -> {
            Throwable last = context.getLastThrowable();
            if (!(last instanceof PmsApiException) || !((PmsApiException) last).isRetryable()) {
                // not retryable, surfaces unchanged
                throw last instanceof RuntimeException
                        ? (RuntimeException) last
                        : new IllegalStateException(last);
            }

            exhaustedCounter.increment();
            log.warn("{} API call for {} gave up after {} attempts", pmsName, params, context.getRetryCount());
            throw new PmsApiException(
                    String.format("%s API unavailable after %d attempts", pmsName, context.getRetryCount()),
                    pmsName,
                    String.valueOf(params),
                    false,
                    last);
        });
    }
}
