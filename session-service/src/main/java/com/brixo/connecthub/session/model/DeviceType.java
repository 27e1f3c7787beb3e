package com.brixo.connecthub.session.model;

import java.util.Locale;

/** Tipo de dispositivo tal como lo reporta la propiedad "type" del daemon. */
public enum DeviceType {
    PHONE,
    TABLET,
    DESKTOP,
    LAPTOP,
    TV,
    UNKNOWN;

    public static DeviceType fromDaemon(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "phone", "smartphone" -> PHONE;
            case "tablet" -> TABLET;
            case "desktop" -> DESKTOP;
            case "laptop" -> LAPTOP;
            case "tv" -> TV;
            default -> UNKNOWN;
        };
    }
}
