package com.brixo.connecthub.session.model;

/** Acciones directas sobre un dispositivo emparejado y el plugin que exigen. */
public enum DeviceAction {
    PING(null),
    RING(PluginKind.FIND_PHONE),
    SEND_CLIPBOARD(PluginKind.CLIPBOARD),
    SHARE_URL(PluginKind.FILE_TRANSFER),
    LOCK(PluginKind.LOCK_DEVICE);

    private final PluginKind requiredPlugin;

    DeviceAction(PluginKind requiredPlugin) {
        this.requiredPlugin = requiredPlugin;
    }

    /** Plugin que debe estar disponible y activo, o null si no hace falta ninguno. */
    public PluginKind requiredPlugin() {
        return requiredPlugin;
    }
}
