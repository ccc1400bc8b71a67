package com.example.chat.realtime.websocket;

import com.example.chat.realtime.dto.inbound.CallAnsweredPayload;
import com.example.chat.realtime.dto.inbound.CallDeclinedPayload;
import com.example.chat.realtime.dto.inbound.CallEndedPayload;
import com.example.chat.realtime.dto.inbound.CallInitiatedPayload;
import com.example.chat.realtime.dto.inbound.CallParticipantPayload;
import com.example.chat.realtime.dto.inbound.ChatRoomPayload;
import com.example.chat.realtime.dto.inbound.LocationShareStartPayload;
import com.example.chat.realtime.dto.inbound.LocationShareStopPayload;
import com.example.chat.realtime.dto.inbound.LocationUpdatePayload;
import com.example.chat.realtime.dto.inbound.MessageReadPayload;
import com.example.chat.realtime.dto.inbound.PingPayload;
import com.example.chat.realtime.dto.inbound.TypingIndicatorPayload;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Client-to-server frame types and the payload class each one decodes into.
 */
public enum InboundMessageType {
    JOIN_CHAT(ChatRoomPayload.class),
    LEAVE_CHAT(ChatRoomPayload.class),
    TYPING_INDICATOR(TypingIndicatorPayload.class),
    MESSAGE_READ(MessageReadPayload.class),
    CALL_INITIATED(CallInitiatedPayload.class),
    CALL_ANSWERED(CallAnsweredPayload.class),
    CALL_DECLINED(CallDeclinedPayload.class),
    CALL_ENDED(CallEndedPayload.class),
    CALL_PARTICIPANT_JOINED(CallParticipantPayload.class),
    CALL_PARTICIPANT_LEFT(CallParticipantPayload.class),
    LOCATION_UPDATE(LocationUpdatePayload.class),
    LOCATION_SHARE_START(LocationShareStartPayload.class),
    LOCATION_SHARE_STOP(LocationShareStopPayload.class),
    PING(PingPayload.class);

    private static final Map<String, InboundMessageType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(InboundMessageType::wireName, Function.identity()));

    private final Class<?> payloadType;

    InboundMessageType(Class<?> payloadType) {
        this.payloadType = payloadType;
    }

    public Class<?> getPayloadType() {
        return payloadType;
    }

    public String wireName() {
        return name().toLowerCase();
    }

    public static Optional<InboundMessageType> fromWireName(String wireName) {
        return Optional.ofNullable(wireName).map(BY_WIRE_NAME::get);
    }
}
