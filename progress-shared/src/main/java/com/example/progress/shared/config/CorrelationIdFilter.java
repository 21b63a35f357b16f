package com.example.progress.shared.config;

import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Tags every HTTP exchange with a request id so that REST calls and the log lines they produce
 * can be matched up. A caller-supplied {@value #CORRELATION_ID_HEADER} is reused as is; otherwise
 * a random one is minted. The id is echoed on the response and exposed to the log pattern as
 * {@code %X{correlation_id}} for the duration of the exchange.
 */
@Component
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    static final String MDC_KEY = "correlation_id";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String requestId = resolveCorrelationId(exchange);
        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, requestId);

        MDC.put(MDC_KEY, requestId);
        return chain.filter(exchange)
                .doFinally(signal -> MDC.remove(MDC_KEY));
    }

    static String resolveCorrelationId(ServerWebExchange exchange) {
        String supplied = exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER);
        return supplied == null || supplied.isBlank() ? UUID.randomUUID().toString() : supplied.trim();
    }
}
