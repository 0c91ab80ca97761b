package com.ridematch.dispatch.controller;

import com.ridematch.dispatch.model.OfferView;
import com.ridematch.dispatch.model.TrackedOffer;
import com.ridematch.dispatch.service.DispatchService;
import com.ridematch.dispatch.service.OfferTracker;
import com.ridematch.shared.dto.ApiResponse;
import com.ridematch.shared.messages.OfferCancelledMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operator endpoints for inspecting and purging live offer state.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/dispatch/rides")
@RequiredArgsConstructor
public class DispatchController {

    private final OfferTracker offerTracker;
    private final DispatchService dispatchService;

    @GetMapping("/{rideId}/offers")
    public ResponseEntity<ApiResponse<List<OfferView>>> listOffers(@PathVariable("rideId") String rideId) {
        List<OfferView> offers = offerTracker.offeredDrivers(rideId).stream()
                .sorted()
                .map(driverId -> toView(rideId, driverId, offerTracker.findOffer(rideId, driverId)))
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(offers));
    }

    @DeleteMapping("/{rideId}/offers")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> withdrawOffers(@PathVariable("rideId") String rideId) {
        int withdrawn = dispatchService.cancelPendingOffers(rideId, null, OfferCancelledMessage.REASON_RIDE_CANCELLED);
        log.info("Operator withdrew {} offers for ride {}", withdrawn, rideId);
        return ResponseEntity.ok(ApiResponse.ok(Map.of("withdrawn", withdrawn)));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleStoreUnavailable(DataAccessException ex) {
        log.error("Offer store unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.error("STORE_UNAVAILABLE", "Offer state is temporarily unavailable"));
    }

    private OfferView toView(String rideId, String driverId, Optional<TrackedOffer> record) {
        return OfferView.builder()
                .rideId(rideId)
                .driverId(driverId)
                .live(record.isPresent())
                .sentAt(record.map(TrackedOffer::getSentAt).orElse(null))
                .expiresAt(record.map(TrackedOffer::getExpiresAt).orElse(null))
                .build();
    }
}
