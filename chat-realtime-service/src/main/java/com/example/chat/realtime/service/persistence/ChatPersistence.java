package com.example.chat.realtime.service.persistence;

import com.example.chat.shared.util.Constants.MessageStatus;
import reactor.core.publisher.Mono;

/**
 * Storage owned by the chat CRUD service. Only the calls the real-time layer makes are listed.
 */
public interface ChatPersistence {

    Mono<Void> updateMessageStatus(String messageId, String chatId, String userId, MessageStatus status);
}
