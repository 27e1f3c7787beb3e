package com.brixo.connecthub.session.controller;

import com.brixo.connecthub.session.model.CommandResult;
import com.brixo.connecthub.session.model.ErrorKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/** Traducción de {@link CommandResult} a respuesta HTTP. */
final class CommandResponses {

    private CommandResponses() {
    }

    static ResponseEntity<CommandResult> toResponse(CommandResult result) {
        if (result.success()) {
            return ResponseEntity.ok(result);
        }
        return ResponseEntity.status(statusOf(result.error())).body(result);
    }

    static HttpStatus statusOf(ErrorKind kind) {
        if (kind == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (kind) {
            case UNKNOWN_DEVICE, UNKNOWN_PLUGIN -> HttpStatus.NOT_FOUND;
            case NOT_PAIRED, INVALID_STATE, PAIRING_REJECTED, PAIRING_FAILED, PAIRING_TIMED_OUT, STALE_TOKEN ->
                    HttpStatus.CONFLICT;
            case BUS_UNAVAILABLE, SUPPRESSION_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
        };
    }
}
