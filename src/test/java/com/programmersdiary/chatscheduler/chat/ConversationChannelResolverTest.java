package com.programmersdiary.chatscheduler.chat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationChannelResolverTest {

    @TempDir
    Path configDir;

    private ConversationRepository repository;
    private ConversationService service;
    private ConversationChannelResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        repository = new ConversationRepository(configDir.toString());
        repository.load();
        service = new ConversationService(repository);
        resolver = new ConversationChannelResolver(repository);
    }

    @Test
    @DisplayName("resolve(): unknown conversation has no sink")
    void unknownConversation() {
        assertThat(resolver.resolve("missing")).isEmpty();
        assertThat(resolver.resolve(null)).isEmpty();
    }

    @Test
    @DisplayName("resolve(): deliveries are appended as assistant messages and persisted")
    void deliveriesAreAppended() throws IOException {
        var conversation = service.create("Reminders");

        var sink = resolver.resolve(conversation.id()).orElseThrow();
        sink.deliver("drink water");
        sink.deliver("a cat", "https://example.org/cat.png");

        var messages = service.get(conversation.id()).messages();
        assertThat(messages).hasSize(2);
        assertThat(messages.get(0).role()).isEqualTo("assistant");
        assertThat(messages.get(0).content()).isEqualTo("drink water");
        assertThat(messages.get(0).attachment()).isNull();
        assertThat(messages.get(1).attachment()).isEqualTo("https://example.org/cat.png");
        assertThat(Files.readString(configDir.resolve("conversations").resolve(conversation.id() + ".json")))
                .contains("drink water");
    }

    @Test
    @DisplayName("load(): conversations survive a restart")
    void conversationsReload() throws IOException {
        var conversation = service.create("  ");
        repository.append(conversation.id(), ChatMessage.of("user", "hi"));

        var reloaded = new ConversationRepository(configDir.toString());
        reloaded.load();

        var restored = reloaded.findById(conversation.id()).orElseThrow();
        assertThat(restored.name()).isEqualTo("Untitled");
        assertThat(restored.messages()).extracting(ChatMessage::content).containsExactly("hi");
    }

    @Test
    @DisplayName("append(): unknown conversation is rejected")
    void appendToUnknownConversation() {
        assertThatThrownBy(() -> repository.append("missing", ChatMessage.of("assistant", "hi")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Conversation not found: missing");
    }
}
