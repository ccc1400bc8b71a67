package com.example.chat.realtime.service.dispatch;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Discriminators of server-to-client frames. The wire name is the lower-case constant name.
 */
public enum OutboundEventType {
    CONNECTION_ESTABLISHED,
    PONG,
    ERROR,
    CHAT_JOINED,
    CHAT_LEFT,
    USER_JOINED_CHAT,
    USER_LEFT_CHAT,
    TYPING_INDICATOR,
    USER_STATUS,
    NEW_MESSAGE,
    MESSAGE_UPDATED,
    MESSAGE_DELETED,
    MESSAGE_READ,
    INCOMING_CALL,
    CALL_INITIATED_SUCCESS,
    CALL_ANSWERED,
    CALL_DECLINED,
    CALL_ENDED,
    CALL_PARTICIPANT_JOINED,
    CALL_PARTICIPANT_LEFT,
    CALL_QUALITY_UPDATE,
    LOCATION_UPDATED,
    SHARED_LOCATION_UPDATE,
    LOCATION_SHARE_STARTED,
    LOCATION_SHARE_STOPPED,
    GEOFENCE_EVENT,
    NOTIFICATION;

    private static final Map<String, OutboundEventType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(OutboundEventType::wireName, Function.identity()));

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static Optional<OutboundEventType> fromWireName(String wireName) {
        return Optional.ofNullable(wireName).map(BY_WIRE_NAME::get);
    }
}
