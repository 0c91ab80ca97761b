package com.ridematch.dispatch.notification;

import com.ridematch.shared.messages.UserNotification;
import com.ridematch.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Hands user notifications to the push gateway through the {@code notification.user} topic,
 * keyed by user id so one user's messages stay ordered.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaNotificationSink implements NotificationSink {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Override
    public void sendToUser(String userId, UserNotification notification) {
        kafkaTemplate.send(KafkaTopics.USER_NOTIFICATIONS, userId, notification)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.warn("Failed to publish {} for user {}: {}", notification.getType(), userId, ex.getMessage());
                    }
                });
    }
}
