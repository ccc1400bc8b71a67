package com.example.chat.realtime.websocket;

import com.example.chat.realtime.service.auth.TokenVerifier;
import com.example.chat.realtime.service.dispatch.EventDispatcher;
import com.example.chat.realtime.service.dispatch.OutboundEvent;
import com.example.chat.realtime.service.dispatch.OutboundEventType;
import com.example.chat.realtime.service.session.ConnectionHandle;
import com.example.chat.realtime.service.session.ConnectionLifecycleManager;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.exception.AuthenticationException;
import com.example.chat.shared.util.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

/**
 * The client WebSocket endpoint.
 * <p>
 * The bearer credential is taken from the {@code token} query parameter, or failing that from an
 * {@code Authorization: Bearer} header. Sessions that fail authentication are closed with code
 * 4001 before anything is registered. Accepted sessions are registered, greeted with
 * {@code connection_established}, and then read frame by frame in arrival order until either
 * side closes, at which point the connection is torn down exactly once.
 */
@Component
@Slf4j
public class ChatWebSocketHandler implements WebSocketHandler {

    private static final String TOKEN_PARAM = "token";
    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenVerifier tokenVerifier;
    private final ConnectionLifecycleManager connectionLifecycleManager;
    private final InboundMessageRouter messageRouter;
    private final EventDispatcher eventDispatcher;
    private final int outboundBufferSize;

    public ChatWebSocketHandler(TokenVerifier tokenVerifier,
                                ConnectionLifecycleManager connectionLifecycleManager,
                                InboundMessageRouter messageRouter,
                                EventDispatcher eventDispatcher,
                                AppProperties appProperties) {
        this.tokenVerifier = tokenVerifier;
        this.connectionLifecycleManager = connectionLifecycleManager;
        this.messageRouter = messageRouter;
        this.eventDispatcher = eventDispatcher;
        this.outboundBufferSize = appProperties.getWebsocket().getOutboundBufferSize();
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        ConnectionSession connection = new ConnectionSession(session.getId());
        String token = extractToken(session.getHandshakeInfo());

        return tokenVerifier.verify(token)
                .switchIfEmpty(Mono.error(() -> new AuthenticationException("Missing credential")))
                .onErrorMap(e -> !(e instanceof AuthenticationException),
                        e -> new AuthenticationException("Credential could not be verified", e))
                .flatMap(userId -> serve(session, connection, userId))
                .onErrorResume(AuthenticationException.class, e -> {
                    log.warn("Rejected WebSocket session {} from {}: {}", session.getId(),
                            session.getHandshakeInfo().getRemoteAddress(), e.getMessage());
                    connection.close();
                    return session.close(new CloseStatus(Constants.CLOSE_AUTHENTICATION_FAILED, "Authentication failed"));
                });
    }

    private Mono<Void> serve(WebSocketSession session, ConnectionSession connection, String userId) {
        WebSocketConnectionChannel channel = new WebSocketConnectionChannel(session, outboundBufferSize);
        ConnectionHandle handle = connectionLifecycleManager.open(userId, channel);
        if (!connection.open(handle)) {
            connectionLifecycleManager.close(handle, "Session closed during handshake");
            return Mono.empty();
        }

        Mono<Void> output = session.send(channel.outbound().map(session::textMessage));

        Mono<Void> input = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(text -> messageRouter.route(handle, text))
                .then()
                .doFinally(signal -> teardown(connection, "Client disconnected (" + signal + ")"));

        Mono<Integer> greeting = eventDispatcher.sendToConnection(handle,
                OutboundEvent.toConnection(handle, OutboundEventType.CONNECTION_ESTABLISHED,
                        OutboundEvent.fields("user_id", userId, "connection_id", handle.getConnectionId())));

        return greeting.then(Mono.zip(input, output).then())
                .doFinally(signal -> teardown(connection, "Session ended (" + signal + ")"));
    }

    private void teardown(ConnectionSession connection, String reason) {
        if (connection.close()) {
            connectionLifecycleManager.close(connection.getHandle(), reason);
        }
    }

    static String extractToken(HandshakeInfo handshakeInfo) {
        String token = UriComponentsBuilder.fromUri(handshakeInfo.getUri()).build()
                .getQueryParams().getFirst(TOKEN_PARAM);
        if (token != null && !token.isBlank()) {
            return token;
        }
        String authorization = handshakeInfo.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }
}
