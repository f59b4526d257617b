package com.medreferral.messaging.http;

import com.medreferral.core.error.ErrorCode;
import com.medreferral.core.util.JsonUtils;
import com.medreferral.messaging.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerResponse;

import java.util.Map;

/**
 * Maps failures to JSON error responses: 400 validation, 401 authentication, 403 authorization,
 * 503 transient, 500 anything else.
 */
public class ErrorResponses {
    private static final Logger log = LoggerFactory.getLogger(ErrorResponses.class);

    private final MetricsService metricsService;

    public ErrorResponses(MetricsService metricsService) {
        this.metricsService = metricsService;
    }

    public Mono<Void> send(HttpServerResponse res, Throwable err) {
        ErrorCode code = ErrorCode.of(err);
        metricsService.recordApiError(code.code());

        String message;
        if (code == ErrorCode.INTERNAL) {
            log.error("Unhandled API error", err);
            message = "Internal error";
        } else {
            log.debug("API request rejected with {}: {}", code.httpStatus(), err.getMessage());
            message = err.getMessage();
        }

        return json(res, code.httpStatus(), Map.of("error", code.code(), "message", String.valueOf(message)));
    }

    static Mono<Void> json(HttpServerResponse res, int status, Object body) {
        return res.status(status)
            .header("Content-Type", "application/json")
            .sendString(Mono.just(JsonUtils.writeValueAsString(body)))
            .then();
    }
}
