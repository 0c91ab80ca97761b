package com.ridematch.pool.controller;

import com.ridematch.pool.entity.PoolPassenger;
import com.ridematch.pool.entity.PoolRide;
import com.ridematch.pool.exception.PoolException;
import com.ridematch.pool.model.AssignDriverRequest;
import com.ridematch.pool.model.ConfirmPoolRequest;
import com.ridematch.pool.model.DriverPoolRideInfo;
import com.ridematch.pool.model.PoolRideRequest;
import com.ridematch.pool.model.PoolRideResponse;
import com.ridematch.pool.model.PoolStats;
import com.ridematch.pool.model.PoolStatusResponse;
import com.ridematch.pool.service.PoolDriverService;
import com.ridematch.pool.service.PoolMatchingService;
import com.ridematch.pool.service.PoolStatsService;
import com.ridematch.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Pool endpoints. The caller (rider or driver) is identified by the X-User-ID header
 * set by the gateway.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/pool")
@RequiredArgsConstructor
public class PoolController {

    private static final String USER_HEADER = "X-User-ID";

    private final PoolMatchingService matchingService;
    private final PoolDriverService driverService;
    private final PoolStatsService statsService;

    @PostMapping("/request")
    public ResponseEntity<ApiResponse<PoolRideResponse>> requestPoolRide(
            @RequestHeader(USER_HEADER) String riderId,
            @Valid @RequestBody PoolRideRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(matchingService.requestPoolRide(riderId, request)));
    }

    @PostMapping("/confirm")
    public ResponseEntity<ApiResponse<Map<String, String>>> confirmPoolRide(
            @RequestHeader(USER_HEADER) String riderId,
            @Valid @RequestBody ConfirmPoolRequest request) {
        matchingService.confirmPoolRide(riderId, request);
        String outcome = Boolean.TRUE.equals(request.getAccept()) ? "Pool ride confirmed" : "Pool ride declined";
        return ResponseEntity.ok(ApiResponse.ok(Map.of("message", outcome)));
    }

    @GetMapping("/{poolRideId}/status")
    public ResponseEntity<ApiResponse<PoolStatusResponse>> getPoolStatus(
            @RequestHeader(USER_HEADER) String riderId,
            @PathVariable("poolRideId") UUID poolRideId) {
        return ResponseEntity.ok(ApiResponse.ok(matchingService.getPoolStatus(riderId, poolRideId)));
    }

    @PostMapping("/passengers/{passengerId}/cancel")
    public ResponseEntity<ApiResponse<Map<String, String>>> cancelPoolRide(
            @RequestHeader(USER_HEADER) String riderId,
            @PathVariable("passengerId") UUID passengerId) {
        matchingService.cancelPoolRide(riderId, passengerId);
        return ResponseEntity.ok(ApiResponse.ok(Map.of("message", "Pool ride cancelled")));
    }

    // Driver endpoints

    @GetMapping("/driver/current")
    public ResponseEntity<ApiResponse<DriverPoolRideInfo>> getDriverPoolRide(
            @RequestHeader(USER_HEADER) String driverId) {
        return ResponseEntity.ok(ApiResponse.ok(driverService.getDriverPoolRide(driverId)));
    }

    @PostMapping("/{poolRideId}/assign")
    public ResponseEntity<ApiResponse<PoolRide>> assignDriver(
            @PathVariable("poolRideId") UUID poolRideId,
            @Valid @RequestBody AssignDriverRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(
                driverService.assignDriver(poolRideId, request.getDriverId(), request.getVehicleId())));
    }

    @PostMapping("/{poolRideId}/start")
    public ResponseEntity<ApiResponse<PoolRide>> startPoolRide(
            @RequestHeader(USER_HEADER) String driverId,
            @PathVariable("poolRideId") UUID poolRideId) {
        return ResponseEntity.ok(ApiResponse.ok(driverService.startPoolRide(driverId, poolRideId)));
    }

    @PostMapping("/driver/passengers/{passengerId}/pickup")
    public ResponseEntity<ApiResponse<PoolPassenger>> pickupPassenger(
            @RequestHeader(USER_HEADER) String driverId,
            @PathVariable("passengerId") UUID passengerId) {
        return ResponseEntity.ok(ApiResponse.ok(driverService.pickupPassenger(driverId, passengerId)));
    }

    @PostMapping("/driver/passengers/{passengerId}/dropoff")
    public ResponseEntity<ApiResponse<PoolPassenger>> dropoffPassenger(
            @RequestHeader(USER_HEADER) String driverId,
            @PathVariable("passengerId") UUID passengerId) {
        return ResponseEntity.ok(ApiResponse.ok(driverService.dropoffPassenger(driverId, passengerId)));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<PoolStats>> getPoolStats() {
        return ResponseEntity.ok(ApiResponse.ok(statsService.getPoolStats()));
    }

    @ExceptionHandler(PoolException.class)
    public ResponseEntity<ApiResponse<Void>> handlePoolException(PoolException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("Pool error [{}]: {}", ex.getCode(), ex.getMessage());
        } else {
            log.warn("Pool error [{}]: {}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatus()).body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .sorted()
                .collect(Collectors.joining(", ", "Invalid or missing fields: ", ""));
        return ResponseEntity.badRequest().body(ApiResponse.error("VALIDATION_FAILED", message));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingUser(MissingRequestHeaderException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ApiResponse.error("UNAUTHENTICATED", "Missing " + ex.getHeaderName() + " header"));
    }
}
