package com.programmersdiary.chatscheduler.delivery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps job kinds to handlers. {@code text} is built in and sends the content verbatim;
 * every other kind comes from the {@link DeliveryHandler} beans present at startup.
 */
@Component
public class DeliveryHandlerRegistry {

    public static final String TEXT_KIND = "text";

    private static final Logger log = LoggerFactory.getLogger(DeliveryHandlerRegistry.class);
    private static final DeliveryHandler TEXT_HANDLER = (sink, store, content) -> sink.deliver(content);

    private final Map<String, DeliveryHandler> handlers;

    public DeliveryHandlerRegistry(Map<String, DeliveryHandler> handlers) {
        this.handlers = Map.copyOf(handlers);
        if (this.handlers.containsKey(TEXT_KIND)) {
            log.warn("Ignoring registered handler for built-in kind '{}'", TEXT_KIND);
        }
        log.info("Delivery kinds available: {}", kinds());
    }

    public Optional<DeliveryHandler> find(String kind) {
        if (kind == null || TEXT_KIND.equals(kind)) {
            return Optional.of(TEXT_HANDLER);
        }
        return Optional.ofNullable(handlers.get(kind));
    }

    public Set<String> kinds() {
        var kinds = new TreeSet<>(handlers.keySet());
        kinds.add(TEXT_KIND);
        return kinds;
    }
}
