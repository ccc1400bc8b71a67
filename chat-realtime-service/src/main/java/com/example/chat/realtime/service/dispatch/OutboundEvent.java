package com.example.chat.realtime.service.dispatch;

import com.example.chat.realtime.service.session.ConnectionHandle;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A server-to-client event: a type, an address and a flat JSON object of data.
 */
@Value
public class OutboundEvent {
    OutboundEventType type;
    EventAddress address;
    Map<String, Object> data;

    private OutboundEvent(OutboundEventType type, EventAddress address, Map<String, Object> data) {
        this.type = type;
        this.address = address;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static OutboundEvent toUser(String userId, OutboundEventType type, Map<String, Object> data) {
        return new OutboundEvent(type, new EventAddress.User(userId), data);
    }

    public static OutboundEvent toUsers(Collection<String> userIds, OutboundEventType type, Map<String, Object> data) {
        return new OutboundEvent(type, new EventAddress.Users(Set.copyOf(userIds)), data);
    }

    public static OutboundEvent toRoom(String roomId, String excludeUserId, OutboundEventType type, Map<String, Object> data) {
        return new OutboundEvent(type, new EventAddress.Room(roomId, excludeUserId), data);
    }

    public static OutboundEvent toConnection(ConnectionHandle handle, OutboundEventType type, Map<String, Object> data) {
        return new OutboundEvent(type, new EventAddress.Connection(handle), data);
    }

    /**
     * Builds an insertion-ordered data map from alternating keys and values. Null values are kept
     * and serialized as JSON null.
     */
    public static Map<String, Object> fields(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected alternating keys and values");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            data.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return data;
    }
}
