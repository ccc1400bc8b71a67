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
import com.example.chat.realtime.service.call.CallSignalingService;
import com.example.chat.realtime.service.dispatch.EventDispatcher;
import com.example.chat.realtime.service.dispatch.OutboundEvent;
import com.example.chat.realtime.service.dispatch.OutboundEventType;
import com.example.chat.realtime.service.location.LocationTrackingService;
import com.example.chat.realtime.service.persistence.ChatPersistence;
import com.example.chat.realtime.service.room.RoomMembershipIndex;
import com.example.chat.realtime.service.session.ConnectionHandle;
import com.example.chat.realtime.service.typing.TypingIndicatorService;
import com.example.chat.shared.exception.PayloadValidationException;
import com.example.chat.shared.exception.ProtocolException;
import com.example.chat.shared.util.Constants;
import com.example.chat.shared.util.Constants.MessageStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

/**
 * Applies one inbound frame on behalf of the connection that sent it.
 * <p>
 * Nothing that goes wrong while handling a frame escapes {@link #route}: protocol and payload
 * problems are answered with an {@code error} frame carrying the reason, anything else with a
 * generic one. Either way the reply goes to the sending connection only.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InboundMessageRouter {

    private final InboundFrameDecoder frameDecoder;
    private final EventDispatcher eventDispatcher;
    private final RoomMembershipIndex roomMembershipIndex;
    private final TypingIndicatorService typingIndicatorService;
    private final ChatPersistence chatPersistence;
    private final CallSignalingService callSignalingService;
    private final LocationTrackingService locationTrackingService;
    private final Clock clock;

    public Mono<Void> route(ConnectionHandle connection, String text) {
        return Mono.defer(() -> handle(connection, frameDecoder.decode(text)))
                .onErrorResume(ProtocolException.class, e -> {
                    if (e instanceof PayloadValidationException) {
                        log.debug("Rejected payload from user {} on connection {}: {}",
                                connection.getUserId(), connection.getConnectionId(), e.getMessage());
                    } else {
                        log.info("Protocol error from user {} on connection {}: {}",
                                connection.getUserId(), connection.getConnectionId(), e.getMessage());
                    }
                    return replyError(connection, e.getMessage());
                })
                .onErrorResume(e -> {
                    log.error("Error handling frame from user {} on connection {}",
                            connection.getUserId(), connection.getConnectionId(), e);
                    return replyError(connection, Constants.GENERIC_ERROR_MESSAGE);
                });
    }

    private Mono<Void> handle(ConnectionHandle connection, DecodedFrame frame) {
        log.debug("Handling {} from user {} on connection {}", frame.type().wireName(),
                connection.getUserId(), connection.getConnectionId());
        return switch (frame.type()) {
            case JOIN_CHAT -> joinChat(connection, frame.payload(ChatRoomPayload.class));
            case LEAVE_CHAT -> leaveChat(connection, frame.payload(ChatRoomPayload.class));
            case TYPING_INDICATOR -> typing(connection, frame.payload(TypingIndicatorPayload.class));
            case MESSAGE_READ -> messageRead(connection, frame.payload(MessageReadPayload.class));
            case CALL_INITIATED -> callSignalingService.initiateCall(connection, frame.payload(CallInitiatedPayload.class));
            case CALL_ANSWERED -> callSignalingService.answerCall(connection, frame.payload(CallAnsweredPayload.class));
            case CALL_DECLINED -> callSignalingService.declineCall(connection, frame.payload(CallDeclinedPayload.class));
            case CALL_ENDED -> callSignalingService.endCall(connection, frame.payload(CallEndedPayload.class));
            case CALL_PARTICIPANT_JOINED -> callSignalingService.participantJoined(connection, frame.payload(CallParticipantPayload.class));
            case CALL_PARTICIPANT_LEFT -> callSignalingService.participantLeft(connection, frame.payload(CallParticipantPayload.class));
            case LOCATION_UPDATE -> locationTrackingService.updateLocation(connection, frame.payload(LocationUpdatePayload.class));
            case LOCATION_SHARE_START -> locationTrackingService.startShare(connection, frame.payload(LocationShareStartPayload.class));
            case LOCATION_SHARE_STOP -> locationTrackingService.stopShare(connection, frame.payload(LocationShareStopPayload.class));
            case PING -> pong(connection, frame.payload(PingPayload.class));
        };
    }

    private Mono<Void> joinChat(ConnectionHandle connection, ChatRoomPayload payload) {
        String chatId = payload.getChatId();
        String userId = connection.getUserId();
        boolean newMember = roomMembershipIndex.join(chatId, userId);

        Mono<Integer> reply = reply(connection, OutboundEventType.CHAT_JOINED, OutboundEvent.fields("chat_id", chatId));
        if (!newMember) {
            return reply.then();
        }
        return reply.then(eventDispatcher.broadcastToRoom(chatId,
                        OutboundEvent.toRoom(chatId, userId, OutboundEventType.USER_JOINED_CHAT,
                                OutboundEvent.fields("chat_id", chatId, "user_id", userId)), userId))
                .then();
    }

    private Mono<Void> leaveChat(ConnectionHandle connection, ChatRoomPayload payload) {
        String chatId = payload.getChatId();
        String userId = connection.getUserId();
        boolean wasMember = roomMembershipIndex.leave(chatId, userId);

        Mono<Integer> reply = typingIndicatorService.stopTypingIn(chatId, userId)
                .then(reply(connection, OutboundEventType.CHAT_LEFT, OutboundEvent.fields("chat_id", chatId)));
        if (!wasMember) {
            return reply.then();
        }
        return reply.then(eventDispatcher.broadcastToRoom(chatId,
                        OutboundEvent.toRoom(chatId, userId, OutboundEventType.USER_LEFT_CHAT,
                                OutboundEvent.fields("chat_id", chatId, "user_id", userId)), userId))
                .then();
    }

    private Mono<Void> typing(ConnectionHandle connection, TypingIndicatorPayload payload) {
        return typingIndicatorService.setTyping(payload.getChatId(), connection.getUserId(), payload.getIsTyping()).then();
    }

    private Mono<Void> messageRead(ConnectionHandle connection, MessageReadPayload payload) {
        String userId = connection.getUserId();
        return chatPersistence.updateMessageStatus(payload.getMessageId(), payload.getChatId(), userId, MessageStatus.READ)
                .then(Mono.defer(() -> eventDispatcher.broadcastToRoom(payload.getChatId(),
                        OutboundEvent.toRoom(payload.getChatId(), userId, OutboundEventType.MESSAGE_READ,
                                OutboundEvent.fields(
                                        "message_id", payload.getMessageId(),
                                        "chat_id", payload.getChatId(),
                                        "user_id", userId,
                                        "read_at", clock.instant().toString())),
                        userId)))
                .then();
    }

    private Mono<Void> pong(ConnectionHandle connection, PingPayload payload) {
        return reply(connection, OutboundEventType.PONG, OutboundEvent.fields("timestamp", payload.getTimestamp())).then();
    }

    private Mono<Void> replyError(ConnectionHandle connection, String message) {
        return reply(connection, OutboundEventType.ERROR, OutboundEvent.fields("message", message)).then();
    }

    private Mono<Integer> reply(ConnectionHandle connection, OutboundEventType type, Map<String, Object> data) {
        return eventDispatcher.sendToConnection(connection, OutboundEvent.toConnection(connection, type, data));
    }
}
