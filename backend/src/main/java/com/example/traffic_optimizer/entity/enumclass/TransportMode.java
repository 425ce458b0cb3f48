package com.example.traffic_optimizer.entity.enumclass;

import com.example.traffic_optimizer.exception.UnknownTransportModeException;

import java.util.List;
import java.util.Locale;

public enum TransportMode {

    DRIVING("driving", "Car", 55, 1.0, true, 1.0, List.of("car")),
    TWO_WHEELER("two-wheeler", "Motorcycle", 55, 0.95, true, 0.7, List.of("two_wheeler", "bike", "motorcycle")),
    BUS("bus", "Bus", 35, 1.15, true, 0.9, List.of()),
    CYCLING("cycling", "Bicycle", 12, 0.9, false, 0.6, List.of("bicycle")),
    WALKING("walking", "Walking", 5, 0.85, false, 0.3, List.of("foot"));

    private final String code;
    private final String displayName;
    private final double averageSpeedKmh;
    private final double distanceMultiplier;
    private final boolean trafficAffected;
    private final double signalWaitMultiplier;
    private final List<String> aliases;

    TransportMode(String code, String displayName, double averageSpeedKmh, double distanceMultiplier,
                  boolean trafficAffected, double signalWaitMultiplier, List<String> aliases) {
        this.code = code;
        this.displayName = displayName;
        this.averageSpeedKmh = averageSpeedKmh;
        this.distanceMultiplier = distanceMultiplier;
        this.trafficAffected = trafficAffected;
        this.signalWaitMultiplier = signalWaitMultiplier;
        this.aliases = aliases;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public double getAverageSpeedKmh() {
        return averageSpeedKmh;
    }

    public double getDistanceMultiplier() {
        return distanceMultiplier;
    }

    public boolean isTrafficAffected() {
        return trafficAffected;
    }

    public double getSignalWaitMultiplier() {
        return signalWaitMultiplier;
    }

    /**
     *  코드/별칭 → 이동수단 (대소문자 무시)
     */
    public static TransportMode from(String value) {
        if (value == null || value.isBlank()) {
            throw new UnknownTransportModeException(String.valueOf(value));
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TransportMode mode : values()) {
            if (mode.code.equals(normalized)
                    || mode.name().toLowerCase(Locale.ROOT).equals(normalized)
                    || mode.aliases.contains(normalized)) {
                return mode;
            }
        }
        throw new UnknownTransportModeException(value);
    }
}
