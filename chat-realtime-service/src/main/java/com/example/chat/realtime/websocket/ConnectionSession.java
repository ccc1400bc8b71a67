package com.example.chat.realtime.websocket;

import com.example.chat.realtime.service.session.ConnectionHandle;
import com.example.chat.shared.util.Constants.ConnectionState;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-socket state: {@code CONNECTING -> OPEN -> CLOSED}. CLOSED is terminal and is entered
 * exactly once, whichever of the read loop, the write side or the dispatcher gets there first.
 */
public class ConnectionSession {

    private final String sessionId;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private volatile ConnectionHandle handle;

    public ConnectionSession(String sessionId) {
        this.sessionId = sessionId;
    }

    /**
     * @return false if the session was already closed, in which case the handle is not adopted
     */
    public boolean open(ConnectionHandle handle) {
        if (state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.OPEN)) {
            this.handle = handle;
            return true;
        }
        return false;
    }

    /**
     * @return true only for the call that moved the session to CLOSED
     */
    public boolean close() {
        return state.getAndSet(ConnectionState.CLOSED) != ConnectionState.CLOSED;
    }

    public ConnectionState getState() {
        return state.get();
    }

    public ConnectionHandle getHandle() {
        return handle;
    }

    public String getSessionId() {
        return sessionId;
    }
}
