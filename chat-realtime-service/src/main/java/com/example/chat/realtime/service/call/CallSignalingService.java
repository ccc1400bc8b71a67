package com.example.chat.realtime.service.call;

import com.example.chat.realtime.dto.inbound.CallAnsweredPayload;
import com.example.chat.realtime.dto.inbound.CallDeclinedPayload;
import com.example.chat.realtime.dto.inbound.CallEndedPayload;
import com.example.chat.realtime.dto.inbound.CallInitiatedPayload;
import com.example.chat.realtime.dto.inbound.CallParticipantPayload;
import com.example.chat.realtime.service.dispatch.EventDispatcher;
import com.example.chat.realtime.service.dispatch.OutboundEvent;
import com.example.chat.realtime.service.dispatch.OutboundEventType;
import com.example.chat.realtime.service.session.ConnectionHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Relays call setup and teardown signals between the parties of a call. The media session
 * itself is negotiated elsewhere; only the channel name travels through here.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CallSignalingService {

    static final String DEFAULT_CALL_TYPE = "video";
    static final String DEFAULT_END_REASON = "user_ended";
    static final String DEFAULT_PARTICIPANT_NAME = "Unknown";

    private final EventDispatcher eventDispatcher;

    public Mono<Void> initiateCall(ConnectionHandle caller, CallInitiatedPayload payload) {
        String callType = orDefault(payload.getCallType(), DEFAULT_CALL_TYPE);
        OutboundEvent incoming = OutboundEvent.toUser(payload.getCalleeId(), OutboundEventType.INCOMING_CALL,
                OutboundEvent.fields(
                        "call_id", payload.getCallId(),
                        "caller_id", caller.getUserId(),
                        "call_type", callType,
                        "channel_name", payload.getChannelName()));

        return eventDispatcher.dispatch(incoming)
                .flatMap(delivered -> {
                    log.info("Call {} from user {} to user {} ({}), callee connections reached: {}",
                            payload.getCallId(), caller.getUserId(), payload.getCalleeId(), callType, delivered);
                    return eventDispatcher.sendToConnection(caller, OutboundEvent.toConnection(caller,
                            OutboundEventType.CALL_INITIATED_SUCCESS,
                            OutboundEvent.fields(
                                    "call_id", payload.getCallId(),
                                    "channel_name", payload.getChannelName(),
                                    "callee_online", delivered > 0)));
                })
                .then();
    }

    public Mono<Void> answerCall(ConnectionHandle callee, CallAnsweredPayload payload) {
        if (!Boolean.TRUE.equals(payload.getAccepted())) {
            return declined(callee, payload.getCallId(), payload.getCallerId());
        }
        log.info("Call {} accepted by user {}", payload.getCallId(), callee.getUserId());
        return eventDispatcher.dispatch(OutboundEvent.toUser(payload.getCallerId(), OutboundEventType.CALL_ANSWERED,
                        OutboundEvent.fields(
                                "call_id", payload.getCallId(),
                                "callee_id", callee.getUserId(),
                                "channel_name", payload.getChannelName())))
                .then();
    }

    public Mono<Void> declineCall(ConnectionHandle callee, CallDeclinedPayload payload) {
        return declined(callee, payload.getCallId(), payload.getCallerId());
    }

    public Mono<Void> endCall(ConnectionHandle actor, CallEndedPayload payload) {
        log.info("Call {} ended by user {}", payload.getCallId(), actor.getUserId());
        return toParticipants(actor, payload.getParticipants(), OutboundEventType.CALL_ENDED,
                OutboundEvent.fields(
                        "call_id", payload.getCallId(),
                        "ended_by", actor.getUserId(),
                        "end_reason", orDefault(payload.getEndReason(), DEFAULT_END_REASON)));
    }

    public Mono<Void> participantJoined(ConnectionHandle actor, CallParticipantPayload payload) {
        return participantChanged(actor, payload, OutboundEventType.CALL_PARTICIPANT_JOINED);
    }

    public Mono<Void> participantLeft(ConnectionHandle actor, CallParticipantPayload payload) {
        return participantChanged(actor, payload, OutboundEventType.CALL_PARTICIPANT_LEFT);
    }

    /**
     * Sends a call event on behalf of the server, e.g. a quality update, to every listed participant.
     */
    public Mono<Integer> broadcastCallEvent(OutboundEventType type, Map<String, Object> data, Collection<String> participants) {
        Set<String> recipients = recipients(participants, null);
        return eventDispatcher.dispatch(OutboundEvent.toUsers(recipients, type, data));
    }

    private Mono<Void> participantChanged(ConnectionHandle actor, CallParticipantPayload payload, OutboundEventType type) {
        return toParticipants(actor, payload.getParticipants(), type,
                OutboundEvent.fields(
                        "call_id", payload.getCallId(),
                        "participant_id", actor.getUserId(),
                        "participant_name", orDefault(payload.getParticipantName(), DEFAULT_PARTICIPANT_NAME)));
    }

    private Mono<Void> declined(ConnectionHandle callee, String callId, String callerId) {
        log.info("Call {} declined by user {}", callId, callee.getUserId());
        return eventDispatcher.dispatch(OutboundEvent.toUser(callerId, OutboundEventType.CALL_DECLINED,
                        OutboundEvent.fields("call_id", callId, "callee_id", callee.getUserId())))
                .then();
    }

    private Mono<Void> toParticipants(ConnectionHandle actor, Collection<String> participants,
                                      OutboundEventType type, Map<String, Object> data) {
        Set<String> recipients = recipients(participants, actor.getUserId());
        if (recipients.isEmpty()) {
            return Mono.empty();
        }
        return eventDispatcher.dispatch(OutboundEvent.toUsers(recipients, type, data)).then();
    }

    private static Set<String> recipients(Collection<String> participants, String excludeUserId) {
        Set<String> recipients = new LinkedHashSet<>();
        if (participants != null) {
            for (String participant : participants) {
                if (participant != null && !participant.isBlank() && !participant.equals(excludeUserId)) {
                    recipients.add(participant);
                }
            }
        }
        return recipients;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
