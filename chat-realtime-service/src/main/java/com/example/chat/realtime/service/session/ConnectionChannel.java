package com.example.chat.realtime.service.session;

import reactor.core.publisher.Mono;

/**
 * Write side of one live client connection.
 */
public interface ConnectionChannel {

    /**
     * Hands one serialized frame to the connection.
     *
     * @return a Mono that completes once the frame is accepted, or errors if the
     * connection cannot take it (closed, overflowing, broken)
     */
    Mono<Void> send(String frame);

    /**
     * Closes the connection. Calling it more than once has no further effect.
     */
    void close(String reason);

    boolean isOpen();
}
