package com.brixo.connecthub.session.model;

/** Clave compuesta de {@link PluginRecord}. */
public record PluginKey(String deviceId, PluginKind kind) {
}
