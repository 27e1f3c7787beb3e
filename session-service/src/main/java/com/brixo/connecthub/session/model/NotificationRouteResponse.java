package com.brixo.connecthub.session.model;

public record NotificationRouteResponse(
        String deviceId,
        EventClass eventClass,
        NotificationRoute route) {
}
