package com.example.chat.realtime.websocket;

/**
 * A validated inbound frame.
 */
public record DecodedFrame(InboundMessageType type, Object payload) {

    public <T> T payload(Class<T> payloadType) {
        return payloadType.cast(payload);
    }
}
