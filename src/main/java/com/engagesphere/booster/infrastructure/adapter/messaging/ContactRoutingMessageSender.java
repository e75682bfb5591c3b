package com.engagesphere.booster.infrastructure.adapter.messaging;

import com.engagesphere.booster.domain.model.ContactMethod;
import com.engagesphere.booster.domain.model.User;
import com.engagesphere.booster.domain.port.out.MessageSender;
import com.engagesphere.booster.domain.port.out.UserRepository;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes content to the channel matching the user's stored contact
 * preference. Never throws.
 */
@Component
public class ContactRoutingMessageSender implements MessageSender {

    private static final Logger logger = LoggerFactory.getLogger(ContactRoutingMessageSender.class);

    private final UserRepository userRepository;
    private final Map<ContactMethod, DeliveryChannel> channels = new EnumMap<>(ContactMethod.class);

    public ContactRoutingMessageSender(UserRepository userRepository, List<DeliveryChannel> deliveryChannels) {
        this.userRepository = userRepository;
        deliveryChannels.forEach(channel -> channels.put(channel.method(), channel));
    }

    @Override
    public void send(long userId, String content) {
        try {
            Optional<User> user = userRepository.findById(userId);
            if (user.isEmpty()) {
                logger.warn("Cannot send message, user {} not found", userId);
                return;
            }

            ContactMethod method = user.get().contactMethod();
            DeliveryChannel channel = channels.getOrDefault(method, channels.get(ContactMethod.EMAIL));
            if (channel == null) {
                logger.error("No delivery channel available for {}", method);
                return;
            }

            channel.deliver(user.get(), OutboundMessage.parse(content));
        } catch (Exception e) {
            logger.error("Error sending message to user {}", userId, e);
        }
    }
}
