package com.example.chat.shared.dto;

import com.example.chat.shared.config.CorrelationIdFilter;
import lombok.AllArgsConstructor;
import lombok.Data;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.server.ServerWebExchange;

import java.time.OffsetDateTime;

/**
 * Body of every failed REST call. {@code correlationId} matches the {@code X-Correlation-ID}
 * response header, so a client report can be traced to the server log lines of that request.
 */
@Data
@AllArgsConstructor
public class ErrorResponse {
    private final OffsetDateTime timestamp;
    private final int status;
    private final String error;
    private final String message;
    private final String path;
    private final String correlationId;

    public static ErrorResponse of(HttpStatusCode status, String error, String message, ServerWebExchange exchange) {
        return new ErrorResponse(OffsetDateTime.now(), status.value(), error, message,
                exchange.getRequest().getPath().value(), CorrelationIdFilter.correlationId(exchange));
    }
}
