package com.brixo.connecthub.session.model;

/** Cuerpo de POST /api/devices/{id}/actions. */
public record DeviceActionRequest(DeviceAction action, String argument) {
}
