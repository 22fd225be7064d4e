package com.brixo.tronbyt.device.sync;

import java.time.Duration;
import java.util.Optional;

/**
 * Punto de espera de una sesión: se despierta por un aviso del
 * {@link SyncNotifier}, por {@link #wakeUp()} o por timeout.
 */
public interface Waiter extends AutoCloseable {

    /**
     * Bloquea hasta recibir un aviso, un {@link #wakeUp()} o agotar el tiempo.
     *
     * @return el aviso recibido; vacío si despertó sin aviso o por timeout
     */
    Optional<SyncPayload> await(Duration timeout) throws InterruptedException;

    /** Despierta a quien esté esperando sin entregar un aviso. */
    void wakeUp();

    @Override
    void close();
}
