package com.programmersdiary.chatscheduler.chat;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Service
public class ConversationService {

    private final ConversationRepository conversationRepository;

    public ConversationService(ConversationRepository conversationRepository) {
        this.conversationRepository = conversationRepository;
    }

    public Conversation create(String name) {
        var trimmed = name != null ? name.trim() : "";
        var conversation = new Conversation(
                UUID.randomUUID().toString(),
                trimmed.isEmpty() ? "Untitled" : trimmed,
                new ArrayList<>(),
                System.currentTimeMillis());
        return conversationRepository.save(conversation);
    }

    public Conversation get(String conversationId) {
        return conversationRepository.findById(conversationId)
                .orElseThrow(() -> new IllegalArgumentException("Conversation not found: " + conversationId));
    }

    public List<Conversation> listAll() {
        return conversationRepository.findAll();
    }
}
