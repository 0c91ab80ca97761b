package com.ridematch.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeoLocation {

    private double lat;
    private double lng;
    private String address;

    public static GeoLocation of(double lat, double lng) {
        return new GeoLocation(lat, lng, null);
    }
}
