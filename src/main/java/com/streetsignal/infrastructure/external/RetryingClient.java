package com.streetsignal.infrastructure.external;

import com.streetsignal.domain.exception.ExternalServiceException;
import com.streetsignal.infrastructure.config.StreetSignalProperties.RetrySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * WebClient wrapper for one external service: every attempt first takes a
 * rate-limit permit, transient failures are retried with exponential backoff
 * and jitter, and the caller blocks until the final outcome.
 *
 * Transient: timeouts, connection errors, HTTP 5xx and HTTP 429.
 * Any other HTTP error fails on the first attempt.
 */
public class RetryingClient {

    private static final Logger logger = LoggerFactory.getLogger(RetryingClient.class);

    private final String service;
    private final WebClient webClient;
    private final RateLimiter rateLimiter;
    private final RetrySettings retrySettings;
    private final Duration timeout;

    public RetryingClient(String service, WebClient webClient, RateLimiter rateLimiter, RetrySettings retrySettings,
            Duration timeout) {
        this.service = service;
        this.webClient = webClient;
        this.rateLimiter = rateLimiter;
        this.retrySettings = retrySettings;
        this.timeout = timeout;
    }

    /**
     * Execute a request built against this service's WebClient.
     *
     * @param operation short label used in logs and error messages
     * @param request builds the call; invoked once per attempt
     * @return the response body
     * @throws ExternalServiceException when the call fails for good
     */
    public <T> T execute(String operation, Function<WebClient, Mono<T>> request) {
        int maxAttempts = Math.max(1, retrySettings.getMaxAttempts());
        AtomicInteger attempts = new AtomicInteger();

        Mono<T> call = Mono.defer(() -> {
                int attempt = attempts.incrementAndGet();
                rateLimiter.acquire();
                logger.debug("{} {}: attempt {}/{}", service, operation, attempt, maxAttempts);
                return request.apply(webClient).timeout(timeout);
            })
            .doOnError(e -> logger.warn("{} {}: attempt {}/{} failed: {}",
                service, operation, attempts.get(), maxAttempts, describe(e)));

        Retry retry = Retry.backoff(maxAttempts - 1, retrySettings.getBaseBackoff())
            .maxBackoff(retrySettings.getMaxBackoff())
            .jitter(retrySettings.getJitter())
            .filter(RetryingClient::isTransient)
            .scheduler(Schedulers.boundedElastic())
            .onRetryExhaustedThrow((spec, signal) -> signal.failure());

        try {
            T result = call.retryWhen(retry).block();
            logger.debug("{} {}: succeeded after {} attempt(s)", service, operation, attempts.get());
            return result;
        } catch (ExternalServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            Integer status = cause instanceof WebClientResponseException responseException
                ? responseException.getStatusCode().value()
                : null;
            String message = String.format("%s %s failed after %d attempt(s): %s",
                service, operation, attempts.get(), describe(cause));
            if (status == null || status != 404) {
                logger.error(message);
            }
            throw new ExternalServiceException(service, message, attempts.get(), status, cause);
        }
    }

    static boolean isTransient(Throwable throwable) {
        if (throwable instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            return status == 429 || responseException.getStatusCode().is5xxServerError();
        }
        return throwable instanceof TimeoutException
            || throwable instanceof WebClientRequestException
            || throwable instanceof IOException;
    }

    private static String describe(Throwable throwable) {
        if (throwable instanceof WebClientResponseException responseException) {
            return "HTTP " + responseException.getStatusCode().value();
        }
        if (throwable instanceof TimeoutException) {
            return "timed out";
        }
        return throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }

    public String getService() {
        return service;
    }
}
