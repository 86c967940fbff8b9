package com.example.ingestionservice.client.external;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;

/**
 * Maps non-2xx upstream responses to {@link ExternalApiException} types.
 * 
 * - 429 → RateLimitExceededException (retriable)
 * - 401/403 → AuthenticationException (fatal, never retried)
 * - anything else → ExternalApiException with the status, classified by the retry policy
 * 
 * Usage: {@code .retrieve().onStatus(HttpStatusCode::isError, r -> UpstreamErrors.map("jira", r))}
 */
@Slf4j
final class UpstreamErrors {

    private static final int MAX_BODY_IN_MESSAGE = 300;

    private UpstreamErrors() {
    }

    static Mono<? extends Throwable> map(String upstream, ClientResponse response) {
        int status = response.statusCode().value();
        if (status == HttpStatus.TOO_MANY_REQUESTS.value()) {
            log.warn("{} rate limit exceeded (429)", upstream);
            return Mono.error(new ExternalApiException.RateLimitExceededException(upstream));
        }
        if (status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value()) {
            log.error("{} authentication failed ({})", upstream, status);
            return Mono.error(new ExternalApiException.AuthenticationException(upstream, status));
        }
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(new ExternalApiException(upstream, status,
                        upstream + " returned " + status + ": " + abbreviate(body))));
    }

    private static String abbreviate(String body) {
        return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }
}
