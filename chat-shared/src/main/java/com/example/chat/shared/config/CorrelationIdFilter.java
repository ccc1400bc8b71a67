package com.example.chat.shared.config;

import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Tags each HTTP request, WebSocket upgrades included, with a correlation id. A caller-supplied
 * {@code X-Correlation-ID} is kept, otherwise a random one is minted. The id is echoed in the
 * response header and kept as an exchange attribute; the log pattern reads it from the MDC key
 * {@code correlation_id}.
 */
@Component
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_KEY = "correlation_id";
    /** Longer inbound ids are replaced rather than logged. */
    static final int MAX_LENGTH = 128;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String supplied = exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER);
        String correlationId = StringUtils.hasText(supplied) && supplied.length() <= MAX_LENGTH
                ? supplied.trim()
                : UUID.randomUUID().toString();

        exchange.getAttributes().put(CORRELATION_ID_KEY, correlationId);
        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);
        MDC.put(CORRELATION_ID_KEY, correlationId);
        return chain.filter(exchange)
                .doFinally(signalType -> MDC.remove(CORRELATION_ID_KEY));
    }

    /**
     * @return the id assigned to this exchange, or null if the filter did not run for it
     */
    public static String correlationId(ServerWebExchange exchange) {
        return exchange.getAttribute(CORRELATION_ID_KEY);
    }
}
