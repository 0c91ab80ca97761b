package com.ridematch.dispatch.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridematch.dispatch.service.DispatchService;
import com.ridematch.dispatch.service.EtaTracker;
import com.ridematch.shared.events.RideAcceptedEvent;
import com.ridematch.shared.events.RideCancelledEvent;
import com.ridematch.shared.events.RideRequestedEvent;
import com.ridematch.shared.events.RideStatusChangedEvent;
import com.ridematch.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class RideEventConsumer {

    private final DispatchService dispatchService;
    private final EtaTracker etaTracker;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = {
                    KafkaTopics.RIDE_REQUESTED,
                    KafkaTopics.RIDE_ACCEPTED,
                    KafkaTopics.RIDE_CANCELLED,
                    KafkaTopics.RIDE_IN_PROGRESS,
                    KafkaTopics.RIDE_COMPLETED
            },
            groupId = "dispatch-service-rides",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeRideEvents(
            @Payload String payload,
            @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
            Acknowledgment ack) {

        try {
            switch (topic) {
                case KafkaTopics.RIDE_REQUESTED ->
                        dispatchService.onRideRequested(objectMapper.readValue(payload, RideRequestedEvent.class));
                case KafkaTopics.RIDE_ACCEPTED -> {
                    RideAcceptedEvent event = objectMapper.readValue(payload, RideAcceptedEvent.class);
                    dispatchService.onRideAccepted(event);
                    etaTracker.onRideAccepted(event);
                }
                case KafkaTopics.RIDE_CANCELLED -> {
                    RideCancelledEvent event = objectMapper.readValue(payload, RideCancelledEvent.class);
                    dispatchService.onRideCancelled(event);
                    etaTracker.onRideCancelled(event);
                }
                case KafkaTopics.RIDE_IN_PROGRESS ->
                        etaTracker.onRideInProgress(objectMapper.readValue(payload, RideStatusChangedEvent.class));
                case KafkaTopics.RIDE_COMPLETED ->
                        etaTracker.onRideCompleted(objectMapper.readValue(payload, RideStatusChangedEvent.class));
                default -> log.debug("Unhandled topic: {}", topic);
            }
            ack.acknowledge();
        } catch (Exception e) {
            log.error("Failed to process ride event from topic {}: {}", topic, e.getMessage(), e);
            ack.acknowledge();
        }
    }
}
