package com.ridematch.shared.util;

/**
 * Central registry of all Kafka topic names.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String DRIVER_LOCATION_UPDATED  = "driver.location.updated";
    public static final String RIDE_REQUESTED           = "ride.requested";
    public static final String RIDE_ACCEPTED            = "ride.accepted";
    public static final String RIDE_CANCELLED           = "ride.cancelled";
    public static final String RIDE_IN_PROGRESS         = "ride.in_progress";
    public static final String RIDE_COMPLETED           = "ride.completed";
    public static final String USER_NOTIFICATIONS       = "notification.user";
}
