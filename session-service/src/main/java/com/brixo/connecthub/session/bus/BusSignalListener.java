package com.brixo.connecthub.session.bus;

/**
 * Receptor de señales del bus.
 *
 * <p>Se invoca en el hilo de la pasarela; la implementación debe encolar el
 * trabajo y volver enseguida.</p>
 */
@FunctionalInterface
public interface BusSignalListener {

    void onSignal(BusSignal signal);
}
