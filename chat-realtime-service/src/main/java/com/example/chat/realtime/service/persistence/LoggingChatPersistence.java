package com.example.chat.realtime.service.persistence;

import com.example.chat.shared.util.Constants.MessageStatus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Stand-in used when no storage adapter is wired: records the status change in the log only.
 */
@Slf4j
public class LoggingChatPersistence implements ChatPersistence {

    @Override
    public Mono<Void> updateMessageStatus(String messageId, String chatId, String userId, MessageStatus status) {
        return Mono.fromRunnable(() -> log.info("Message {} in chat {} marked {} by user {}", messageId, chatId, status, userId));
    }
}
