package com.brixo.connecthub.session.model;

/**
 * Lecturas de batería y cobertura móvil que publica el teléfono.
 * Cada campo es null mientras el plugin correspondiente no lo haya informado.
 *
 * @param batteryCharge       carga en porcentaje (0-100)
 * @param charging            si está conectado al cargador
 * @param cellularStrength    intensidad de señal en barras (0-4)
 * @param cellularNetworkType tecnología de red ("LTE", "5G", ...)
 */
public record DeviceTelemetry(
        Integer batteryCharge,
        Boolean charging,
        Integer cellularStrength,
        String cellularNetworkType) {

    private static final DeviceTelemetry NONE = new DeviceTelemetry(null, null, null, null);

    public static DeviceTelemetry none() {
        return NONE;
    }

    public boolean isEmpty() {
        return batteryCharge == null && charging == null && cellularStrength == null && cellularNetworkType == null;
    }
}
