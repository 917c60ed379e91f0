package com.programmersdiary.chatscheduler.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class ConversationRepository {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final Path conversationsDir;
    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();

    public ConversationRepository(
            @Value("${chatscheduler.config-dir:${user.home}/.chatscheduler}") String configDir) {
        this.conversationsDir = Path.of(configDir, "conversations");
    }

    @PostConstruct
    void load() throws IOException {
        Files.createDirectories(conversationsDir);
        try (var stream = Files.list(conversationsDir)) {
            stream.filter(p -> p.toString().endsWith(".json"))
                    .forEach(p -> {
                        try {
                            var conv = objectMapper.readValue(p.toFile(), Conversation.class);
                            conversations.put(conv.id(), conv);
                        } catch (IOException e) {
                            throw new UncheckedIOException(e);
                        }
                    });
        }
    }

    public List<Conversation> findAll() {
        return conversations.values().stream()
                .sorted(Comparator.comparing(Conversation::createdAtMillis,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
    }

    public Optional<Conversation> findById(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(conversations.get(id));
    }

    public Conversation save(Conversation conversation) {
        conversations.put(conversation.id(), conversation);
        persist(conversation);
        return conversation;
    }

    /**
     * Appends a message and saves. Serialized per conversation so concurrent appends
     * from request threads and the dispatcher do not lose messages.
     */
    public Conversation append(String id, ChatMessage message) {
        var updated = conversations.computeIfPresent(id, (key, conv) -> {
            var messages = new ArrayList<>(conv.messages() != null ? conv.messages() : List.<ChatMessage>of());
            messages.add(message);
            var next = new Conversation(conv.id(), conv.name(), messages, conv.createdAtMillis());
            persist(next);
            return next;
        });
        if (updated == null) {
            throw new IllegalArgumentException("Conversation not found: " + id);
        }
        return updated;
    }

    private void persist(Conversation conversation) {
        try {
            Files.createDirectories(conversationsDir);
            objectMapper.writeValue(conversationsDir.resolve(conversation.id() + ".json").toFile(), conversation);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
