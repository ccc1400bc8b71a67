package com.example.chat.realtime.websocket;

import com.example.chat.realtime.service.session.ConnectionChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outbound side of a WebSocket session. Frames go into a bounded buffer drained by the
 * session's send loop; a full buffer means the client is not keeping up and the write fails.
 */
@Slf4j
public class WebSocketConnectionChannel implements ConnectionChannel {

    private final WebSocketSession session;
    private final Sinks.Many<String> sink;
    private final AtomicBoolean open = new AtomicBoolean(true);

    public WebSocketConnectionChannel(WebSocketSession session, int bufferSize) {
        this.session = session;
        this.sink = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(bufferSize).get());
    }

    public Flux<String> outbound() {
        return sink.asFlux();
    }

    @Override
    public Mono<Void> send(String frame) {
        if (!open.get()) {
            return Mono.error(new IllegalStateException("Connection is closed"));
        }
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(frame);
        }
        if (result.isSuccess()) {
            return Mono.empty();
        }
        return Mono.error(new IllegalStateException("Outbound buffer rejected frame: " + result));
    }

    @Override
    public void close(String reason) {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        synchronized (sink) {
            sink.tryEmitComplete();
        }
        session.close(CloseStatus.NORMAL.withReason(reason))
                .subscribe(null, error -> log.debug("Error closing WebSocket session {}: {}", session.getId(), error.getMessage()));
    }

    @Override
    public boolean isOpen() {
        return open.get() && session.isOpen();
    }
}
