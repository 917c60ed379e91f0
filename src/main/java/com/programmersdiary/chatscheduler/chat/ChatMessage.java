package com.programmersdiary.chatscheduler.chat;

public record ChatMessage(String role, String content, String attachment, long timestampMillis) {

    public static ChatMessage of(String role, String content) {
        return new ChatMessage(role, content, null, System.currentTimeMillis());
    }

    public static ChatMessage of(String role, String content, String attachment) {
        return new ChatMessage(role, content, attachment, System.currentTimeMillis());
    }
}
