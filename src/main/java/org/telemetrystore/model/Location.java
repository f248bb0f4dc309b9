package org.telemetrystore.model;

/**
 * One geolocation sample. Every field may be absent (null) when the client
 * could not supply it, e.g. {@code speed} on a stationary device.
 */
public record Location(Double lat, Double lng, Double accuracy, Double speed) {

    public static Location of(double lat, double lng) {
        return new Location(lat, lng, null, null);
    }
}
