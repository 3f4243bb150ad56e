package com.hospitality.staysync.config;

import com.hospitality.staysync.exception.PmsApiException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.backoff.NoBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.Map;

/**
 * Retry template for vendor API calls.
 * <p>
 * Only {@link PmsApiException} is retried. Attempts are count-bounded and,
 * with the default delay of 0, immediate:
 * - pms.api.max-attempts: total attempts, first call included
 * - pms.api.retry-delay-ms: fixed pause between attempts
 */
@Configuration
public class RetryConfig {

    @Bean
    public RetryTemplate pmsApiRetryTemplate(
            @Value("${pms.api.max-attempts:10}") int maxAttempts,
            @Value("${pms.api.retry-delay-ms:0}") long retryDelayMs) {

        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(
                maxAttempts,
                Map.of(PmsApiException.class, true),
                true
        );

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(retryPolicy);
        retryTemplate.setBackOffPolicy(backOffPolicy(retryDelayMs));
        return retryTemplate;
    }

    private BackOffPolicy backOffPolicy(long retryDelayMs) {
        if (retryDelayMs <= 0) {
            return new NoBackOffPolicy();
        }
        FixedBackOffPolicy fixed = new FixedBackOffPolicy();
        fixed.setBackOffPeriod(retryDelayMs);
        return fixed;
    }
}
