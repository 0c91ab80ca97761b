package com.ridematch.pool.service;

import com.ridematch.pool.config.PoolProperties;
import com.ridematch.pool.entity.PoolPassenger;
import com.ridematch.pool.entity.PoolRide;
import com.ridematch.pool.entity.RouteStop;
import com.ridematch.pool.event.PoolRouteChangedEvent;
import com.ridematch.pool.exception.PoolException;
import com.ridematch.pool.model.DriverPoolRideInfo;
import com.ridematch.pool.model.PassengerStatus;
import com.ridematch.pool.model.PoolStatus;
import com.ridematch.pool.model.RouteStopType;
import com.ridematch.pool.repository.PoolPassengerRepository;
import com.ridematch.pool.repository.PoolRideRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PoolDriverServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String DRIVER = "driver-1";

    @Mock private PoolRideRepository poolRideRepository;
    @Mock private PoolPassengerRepository passengerRepository;
    @Mock private ApplicationEventPublisher eventPublisher;

    private PoolDriverService service;

    @BeforeEach
    void setUp() {
        service = new PoolDriverService(poolRideRepository, passengerRepository,
                new PoolFareCalculator(PoolProperties.defaults()), eventPublisher, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("assignDriver")
    class AssignDriver {

        @Test
        @DisplayName("A matching pool is confirmed with the driver and vehicle")
        void assignsMatchingPool() {
            PoolRide pool = pool(PoolStatus.MATCHING, null);
            when(poolRideRepository.findById(pool.getId())).thenReturn(Optional.of(pool));
            when(poolRideRepository.findFirstByDriverIdAndStatusIn(DRIVER, PoolStatus.DRIVER_ACTIVE)).thenReturn(Optional.empty());
            when(poolRideRepository.saveAndFlush(pool)).then(returnsFirstArg());

            PoolRide assigned = service.assignDriver(pool.getId(), DRIVER, "vehicle-9");

            assertThat(assigned.getStatus()).isEqualTo(PoolStatus.CONFIRMED);
            assertThat(assigned.getDriverId()).isEqualTo(DRIVER);
            assertThat(assigned.getVehicleId()).isEqualTo("vehicle-9");
        }

        @Test
        @DisplayName("A pool past matching cannot take a driver")
        void rejectsConfirmedPool() {
            PoolRide pool = pool(PoolStatus.CONFIRMED, "driver-2");
            when(poolRideRepository.findById(pool.getId())).thenReturn(Optional.of(pool));

            assertThatThrownBy(() -> service.assignDriver(pool.getId(), DRIVER, null))
                    .isInstanceOfSatisfying(PoolException.class,
                            e -> assertThat(e.getCode()).isEqualTo("POOL_NOT_MATCHING"));
            assertThat(pool.getDriverId()).isEqualTo("driver-2");
        }

        @Test
        @DisplayName("A driver already serving a pool is busy")
        void rejectsBusyDriver() {
            PoolRide pool = pool(PoolStatus.MATCHING, null);
            when(poolRideRepository.findById(pool.getId())).thenReturn(Optional.of(pool));
            when(poolRideRepository.findFirstByDriverIdAndStatusIn(DRIVER, PoolStatus.DRIVER_ACTIVE))
                    .thenReturn(Optional.of(pool(PoolStatus.IN_PROGRESS, DRIVER)));

            assertThatThrownBy(() -> service.assignDriver(pool.getId(), DRIVER, null))
                    .isInstanceOfSatisfying(PoolException.class,
                            e -> assertThat(e.getStatus()).isEqualTo(HttpStatus.CONFLICT));
            verify(poolRideRepository, never()).saveAndFlush(any());
        }
    }

    @Nested
    @DisplayName("startPoolRide")
    class StartPoolRide {

        @Test
        void startsConfirmedPool() {
            PoolRide pool = pool(PoolStatus.CONFIRMED, DRIVER);
            when(poolRideRepository.findById(pool.getId())).thenReturn(Optional.of(pool));
            when(poolRideRepository.saveAndFlush(pool)).then(returnsFirstArg());

            PoolRide started = service.startPoolRide(DRIVER, pool.getId());

            assertThat(started.getStatus()).isEqualTo(PoolStatus.IN_PROGRESS);
            assertThat(started.getStartedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Only the assigned driver can start the pool")
        void otherDriverForbidden() {
            PoolRide pool = pool(PoolStatus.CONFIRMED, "driver-2");
            when(poolRideRepository.findById(pool.getId())).thenReturn(Optional.of(pool));

            assertThatThrownBy(() -> service.startPoolRide(DRIVER, pool.getId()))
                    .isInstanceOfSatisfying(PoolException.class,
                            e -> assertThat(e.getStatus()).isEqualTo(HttpStatus.FORBIDDEN));
        }
    }

    @Nested
    @DisplayName("pickupPassenger")
    class PickupPassenger {

        @Test
        @DisplayName("First pickup starts the pool and records the pickup arrival")
        void firstPickupStartsPool() {
            PoolRide pool = pool(PoolStatus.CONFIRMED, DRIVER);
            PoolPassenger passenger = passenger(pool.getId(), PassengerStatus.CONFIRMED, "10.00");
            pool.replaceRoute(List.of(
                    stop(passenger.getId(), RouteStopType.PICKUP, 1),
                    stop(passenger.getId(), RouteStopType.DROPOFF, 2)), 10.0, 20);
            when(poolRideRepository.findFirstByDriverIdAndStatusIn(DRIVER, PoolStatus.DRIVER_ACTIVE)).thenReturn(Optional.of(pool));
            when(passengerRepository.findById(passenger.getId())).thenReturn(Optional.of(passenger));
            when(passengerRepository.save(passenger)).then(returnsFirstArg());

            PoolPassenger picked = service.pickupPassenger(DRIVER, passenger.getId());

            assertThat(picked.getStatus()).isEqualTo(PassengerStatus.PICKED_UP);
            assertThat(picked.getPickedUpAt()).isEqualTo(NOW);
            assertThat(pool.getStatus()).isEqualTo(PoolStatus.IN_PROGRESS);
            assertThat(pool.getStartedAt()).isEqualTo(NOW);
            assertThat(pool.getRoute().get(0).getActualArrival()).isEqualTo(NOW);
            assertThat(pool.getRoute().get(1).getActualArrival()).isNull();
            verify(poolRideRepository).saveAndFlush(pool);
            verify(eventPublisher).publishEvent(new PoolRouteChangedEvent(pool.getId(), PoolRouteChangedEvent.PICKED_UP));
        }

        @Test
        @DisplayName("An unconfirmed passenger cannot be picked up")
        void pendingPassengerRejected() {
            PoolRide pool = pool(PoolStatus.IN_PROGRESS, DRIVER);
            PoolPassenger passenger = passenger(pool.getId(), PassengerStatus.PENDING, "10.00");
            when(poolRideRepository.findFirstByDriverIdAndStatusIn(DRIVER, PoolStatus.DRIVER_ACTIVE)).thenReturn(Optional.of(pool));
            when(passengerRepository.findById(passenger.getId())).thenReturn(Optional.of(passenger));

            assertThatThrownBy(() -> service.pickupPassenger(DRIVER, passenger.getId()))
                    .isInstanceOfSatisfying(PoolException.class,
                            e -> assertThat(e.getCode()).isEqualTo("PASSENGER_NOT_CONFIRMED"));
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("A passenger of another pool is forbidden")
        void passengerOfAnotherPool() {
            PoolRide pool = pool(PoolStatus.IN_PROGRESS, DRIVER);
            PoolPassenger passenger = passenger(UUID.randomUUID(), PassengerStatus.CONFIRMED, "10.00");
            when(poolRideRepository.findFirstByDriverIdAndStatusIn(DRIVER, PoolStatus.DRIVER_ACTIVE)).thenReturn(Optional.of(pool));
            when(passengerRepository.findById(passenger.getId())).thenReturn(Optional.of(passenger));

            assertThatThrownBy(() -> service.pickupPassenger(DRIVER, passenger.getId()))
                    .isInstanceOfSatisfying(PoolException.class,
                            e -> assertThat(e.getCode()).isEqualTo("NOT_IN_YOUR_POOL"));
        }

        @Test
        @DisplayName("A driver without an active pool is forbidden")
        void noActivePool() {
            when(poolRideRepository.findFirstByDriverIdAndStatusIn(DRIVER, PoolStatus.DRIVER_ACTIVE)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.pickupPassenger(DRIVER, UUID.randomUUID()))
                    .isInstanceOfSatisfying(PoolException.class,
                            e -> assertThat(e.getStatus()).isEqualTo(HttpStatus.FORBIDDEN));
        }
    }

    @Nested
    @DisplayName("dropoffPassenger")
    class DropoffPassenger {

        @Test
        @DisplayName("Dropping off the last open passenger completes the pool")
        void lastDropoffCompletesPool() {
            PoolRide pool = pool(PoolStatus.IN_PROGRESS, DRIVER);
            PoolPassenger passenger = passenger(pool.getId(), PassengerStatus.PICKED_UP, "10.00");
            PoolPassenger cancelled = passenger(pool.getId(), PassengerStatus.CANCELLED, "8.00");
            when(poolRideRepository.findFirstByDriverIdAndStatusIn(DRIVER, PoolStatus.DRIVER_ACTIVE)).thenReturn(Optional.of(pool));
            when(passengerRepository.findById(passenger.getId())).thenReturn(Optional.of(passenger));
            when(passengerRepository.save(passenger)).then(returnsFirstArg());
            when(passengerRepository.findByPoolRideIdOrderByCreatedAtAscIdAsc(pool.getId()))
                    .thenReturn(List.of(passenger, cancelled));

            PoolPassenger dropped = service.dropoffPassenger(DRIVER, passenger.getId());

            assertThat(dropped.getStatus()).isEqualTo(PassengerStatus.DROPPED_OFF);
            assertThat(dropped.getDroppedOffAt()).isEqualTo(NOW);
            assertThat(pool.getStatus()).isEqualTo(PoolStatus.COMPLETED);
            assertThat(pool.getCompletedAt()).isEqualTo(NOW);
            verify(eventPublisher, never()).publishEvent(any(Object.class));
        }

        @Test
        @DisplayName("Dropping off with riders still aboard keeps the pool going")
        void dropoffWithOthersAboard() {
            PoolRide pool = pool(PoolStatus.IN_PROGRESS, DRIVER);
            PoolPassenger passenger = passenger(pool.getId(), PassengerStatus.PICKED_UP, "10.00");
            PoolPassenger aboard = passenger(pool.getId(), PassengerStatus.PICKED_UP, "12.00");
            when(poolRideRepository.findFirstByDriverIdAndStatusIn(DRIVER, PoolStatus.DRIVER_ACTIVE)).thenReturn(Optional.of(pool));
            when(passengerRepository.findById(passenger.getId())).thenReturn(Optional.of(passenger));
            when(passengerRepository.save(passenger)).then(returnsFirstArg());
            when(passengerRepository.findByPoolRideIdOrderByCreatedAtAscIdAsc(pool.getId()))
                    .thenReturn(List.of(passenger, aboard));

            service.dropoffPassenger(DRIVER, passenger.getId());

            assertThat(pool.getStatus()).isEqualTo(PoolStatus.IN_PROGRESS);
            verify(eventPublisher).publishEvent(new PoolRouteChangedEvent(pool.getId(), PoolRouteChangedEvent.DROPPED_OFF));
        }

        @Test
        void notPickedUpRejected() {
            PoolRide pool = pool(PoolStatus.IN_PROGRESS, DRIVER);
            PoolPassenger passenger = passenger(pool.getId(), PassengerStatus.CONFIRMED, "10.00");
            when(poolRideRepository.findFirstByDriverIdAndStatusIn(DRIVER, PoolStatus.DRIVER_ACTIVE)).thenReturn(Optional.of(pool));
            when(passengerRepository.findById(passenger.getId())).thenReturn(Optional.of(passenger));

            assertThatThrownBy(() -> service.dropoffPassenger(DRIVER, passenger.getId()))
                    .isInstanceOfSatisfying(PoolException.class,
                            e -> assertThat(e.getCode()).isEqualTo("PASSENGER_NOT_PICKED_UP"));
        }
    }

    @Nested
    @DisplayName("getDriverPoolRide")
    class GetDriverPoolRide {

        @Test
        @DisplayName("Totals exclude cancelled riders and the next stop is the first unreached one")
        void summarisesPool() {
            PoolRide pool = pool(PoolStatus.IN_PROGRESS, DRIVER);
            PoolPassenger first = passenger(pool.getId(), PassengerStatus.PICKED_UP, "10.00");
            PoolPassenger second = passenger(pool.getId(), PassengerStatus.CONFIRMED, "12.50");
            PoolPassenger cancelled = passenger(pool.getId(), PassengerStatus.CANCELLED, "8.00");
            RouteStop reached = stop(first.getId(), RouteStopType.PICKUP, 1).toBuilder().actualArrival(NOW).build();
            RouteStop next = stop(second.getId(), RouteStopType.PICKUP, 2);
            pool.replaceRoute(List.of(reached, next,
                    stop(first.getId(), RouteStopType.DROPOFF, 3),
                    stop(second.getId(), RouteStopType.DROPOFF, 4)), 14.0, 32);
            when(poolRideRepository.findFirstByDriverIdAndStatusIn(DRIVER, PoolStatus.DRIVER_ACTIVE)).thenReturn(Optional.of(pool));
            when(passengerRepository.findByPoolRideIdOrderByCreatedAtAscIdAsc(pool.getId()))
                    .thenReturn(List.of(first, second, cancelled));

            DriverPoolRideInfo info = service.getDriverPoolRide(DRIVER);

            assertThat(info.getTotalFare()).isEqualByComparingTo("22.50");
            assertThat(info.getDriverEarnings()).isEqualByComparingTo("16.88");
            assertThat(info.getNextStop()).isEqualTo(next);
            assertThat(info.getPassengers()).hasSize(3);
            assertThat(info.getRouteStops()).hasSize(4);
        }

        @Test
        void noActivePool() {
            when(poolRideRepository.findFirstByDriverIdAndStatusIn(DRIVER, PoolStatus.DRIVER_ACTIVE)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.getDriverPoolRide(DRIVER))
                    .isInstanceOfSatisfying(PoolException.class,
                            e -> assertThat(e.getStatus()).isEqualTo(HttpStatus.NOT_FOUND));
        }
    }

    private static PoolRide pool(PoolStatus status, String driverId) {
        return PoolRide.builder()
                .id(UUID.randomUUID())
                .version(0L)
                .status(status)
                .driverId(driverId)
                .maxPassengers(4)
                .currentPassengers(2)
                .matchDeadline(NOW)
                .route(new ArrayList<>())
                .build();
    }

    private static PoolPassenger passenger(UUID poolRideId, PassengerStatus status, String fare) {
        return PoolPassenger.builder()
                .id(UUID.randomUUID())
                .poolRideId(poolRideId)
                .riderId("rider-" + UUID.randomUUID())
                .status(status)
                .seatCount(1)
                .poolFare(new BigDecimal(fare))
                .build();
    }

    private static RouteStop stop(UUID passengerId, RouteStopType type, int order) {
        return RouteStop.builder().poolPassengerId(passengerId).type(type).sequenceOrder(order).build();
    }
}
