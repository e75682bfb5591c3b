package com.engagesphere.booster.infrastructure.adapter.messaging;

import com.engagesphere.booster.domain.model.ContactMethod;
import com.engagesphere.booster.domain.model.User;
import com.engagesphere.booster.infrastructure.config.MessagingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Component
public class EmailChannel implements DeliveryChannel {

    private static final Logger logger = LoggerFactory.getLogger(EmailChannel.class);

    private final ObjectProvider<JavaMailSender> mailSender;
    private final MessagingProperties properties;

    public EmailChannel(ObjectProvider<JavaMailSender> mailSender, MessagingProperties properties) {
        this.mailSender = mailSender;
        this.properties = properties;
    }

    @Override
    public ContactMethod method() {
        return ContactMethod.EMAIL;
    }

    @Override
    public void deliver(User recipient, OutboundMessage message) {
        JavaMailSender sender = mailSender.getIfAvailable();
        String from = properties.getMailFrom();
        if (sender == null || from == null || from.isBlank()) {
            logger.warn("Mail is not configured. Simulating email send");
            logger.info("[SIMULATED] Email to {} | Subject: {}", recipient.email(), message.subject());
            return;
        }

        SimpleMailMessage mail = new SimpleMailMessage();
        mail.setFrom(from);
        mail.setTo(recipient.email());
        mail.setSubject(message.subject());
        mail.setText(message.body());
        sender.send(mail);

        logger.info("Email sent to {} | Subject: {}", recipient.email(), message.subject());
    }
}
