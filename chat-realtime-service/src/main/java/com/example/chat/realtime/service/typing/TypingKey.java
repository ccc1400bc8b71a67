package com.example.chat.realtime.service.typing;

public record TypingKey(String roomId, String userId) {
}
