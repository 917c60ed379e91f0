package com.programmersdiary.chatscheduler.chat;

import com.programmersdiary.chatscheduler.delivery.ChannelResolver;
import com.programmersdiary.chatscheduler.delivery.DeliverySink;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves a channel id to a conversation. Deliveries are appended as assistant messages.
 */
@Component
public class ConversationChannelResolver implements ChannelResolver {

    private final ConversationRepository conversationRepository;

    public ConversationChannelResolver(ConversationRepository conversationRepository) {
        this.conversationRepository = conversationRepository;
    }

    @Override
    public Optional<DeliverySink> resolve(String channelId) {
        return conversationRepository.findById(channelId)
                .<DeliverySink>map(conversation -> (text, attachment) ->
                        conversationRepository.append(conversation.id(), ChatMessage.of("assistant", text, attachment)));
    }
}
