package com.programmersdiary.chatscheduler.delivery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DeliveryHandlerRegistryTest {

    @Test
    @DisplayName("find(): text is built in and sends content verbatim")
    void textIsBuiltIn() throws Exception {
        var registry = new DeliveryHandlerRegistry(Map.of());
        var sent = new ArrayList<String>();

        registry.find("text").orElseThrow().deliver((text, attachment) -> sent.add(text), null, "hello");

        assertThat(sent).containsExactly("hello");
        assertThat(registry.kinds()).containsExactly("text");
    }

    @Test
    @DisplayName("find(): null kind falls back to text")
    void nullKindIsText() {
        var registry = new DeliveryHandlerRegistry(Map.of());

        assertThat(registry.find(null)).isPresent();
    }

    @Test
    @DisplayName("find(): registered kinds resolve, unknown kinds do not")
    void registeredKinds() {
        DeliveryHandler search = (sink, store, content) -> sink.deliver("found " + content);
        var registry = new DeliveryHandlerRegistry(Map.of("image_search", search));

        assertThat(registry.find("image_search")).containsSame(search);
        assertThat(registry.find("weather")).isEmpty();
        assertThat(registry.kinds()).containsExactly("image_search", "text");
    }

    @Test
    @DisplayName("find(): a bean registered as text does not replace the built-in handler")
    void textCannotBeOverridden() throws Exception {
        var overrides = new ArrayList<String>();
        DeliveryHandler override = (sink, store, content) -> overrides.add(content);
        var registry = new DeliveryHandlerRegistry(Map.of("text", override));
        List<String> sent = new ArrayList<>();

        registry.find("text").orElseThrow().deliver((text, attachment) -> sent.add(text), null, "hello");

        assertThat(sent).containsExactly("hello");
        assertThat(overrides).isEmpty();
    }

    @Test
    @DisplayName("DeliveryException: messages name the channel and kind")
    void exceptionMessages() {
        assertThat(DeliveryException.channelNotFound("42")).hasMessage("Channel 42 not found");
        assertThat(DeliveryException.unsupportedKind("image_search"))
                .hasMessage("Unsupported schedule kind: image_search");
    }
}
