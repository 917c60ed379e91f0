package com.programmersdiary.chatscheduler.chat;

import java.util.List;

/**
 * A chat conversation. Its id doubles as the channel id scheduled messages are delivered to.
 */
public record Conversation(String id,
                           String name,
                           List<ChatMessage> messages,
                           Long createdAtMillis) {
}
