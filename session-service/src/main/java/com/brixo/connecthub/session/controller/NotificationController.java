package com.brixo.connecthub.session.controller;

import com.brixo.connecthub.session.model.EventClass;
import com.brixo.connecthub.session.model.NotificationRouteResponse;
import com.brixo.connecthub.session.service.NotificationArbiter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Decisión del árbitro para los notificadores nativos.
 *
 * GET /api/notifications/route?deviceId=...&eventClass=PAIRING_REQUEST
 *   → { "deviceId": ..., "eventClass": ..., "route": "NATIVE" | "DAEMON" }
 */
@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    private final NotificationArbiter notificationArbiter;

    public NotificationController(NotificationArbiter notificationArbiter) {
        this.notificationArbiter = notificationArbiter;
    }

    @GetMapping("/route")
    public ResponseEntity<NotificationRouteResponse> route(
            @RequestParam(required = false) String deviceId,
            @RequestParam EventClass eventClass) {
        return ResponseEntity.ok(new NotificationRouteResponse(deviceId, eventClass,
                notificationArbiter.route(deviceId, eventClass)));
    }
}
