package com.programmersdiary.chatscheduler.delivery;

import java.util.Optional;

public interface ChannelResolver {

    Optional<DeliverySink> resolve(String channelId);
}
