package com.ridematch.dispatch.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridematch.dispatch.service.EtaTracker;
import com.ridematch.shared.events.DriverLocationUpdatedEvent;
import com.ridematch.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class DriverLocationConsumer {

    private final EtaTracker etaTracker;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = KafkaTopics.DRIVER_LOCATION_UPDATED,
            groupId = "dispatch-service-eta",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeLocationUpdate(@Payload String payload, Acknowledgment ack) {
        try {
            etaTracker.onDriverLocationUpdated(objectMapper.readValue(payload, DriverLocationUpdatedEvent.class));
            ack.acknowledge();
        } catch (Exception e) {
            log.error("Failed to process driver location update: {}", e.getMessage(), e);
            ack.acknowledge();
        }
    }
}
