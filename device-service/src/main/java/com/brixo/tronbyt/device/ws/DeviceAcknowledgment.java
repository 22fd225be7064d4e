package com.brixo.tronbyt.device.ws;

/**
 * Estado de acuses de una sesión: último "queued" y "displaying" recibidos.
 * El receptor lo escribe y el emisor lo consume entre frame y frame.
 */
public class DeviceAcknowledgment {

    private final Runnable onDisplaying;
    private long queuedSeq = -1;
    private long displayingSeq = -1;
    private boolean displayingPending;

    /**
     * @param onDisplaying se ejecuta con cada "displaying" para despertar al emisor
     */
    public DeviceAcknowledgment(Runnable onDisplaying) {
        this.onDisplaying = onDisplaying;
    }

    public synchronized void markQueued(long seq) {
        queuedSeq = seq;
    }

    public void markDisplaying(long seq) {
        synchronized (this) {
            displayingSeq = seq;
            displayingPending = true;
        }
        onDisplaying.run();
    }

    /** Devuelve true (una sola vez) si llegó un "displaying" desde la última consulta. */
    public synchronized boolean consumeDisplaying() {
        boolean pending = displayingPending;
        displayingPending = false;
        return pending;
    }

    /** Descarta acuses que llegaron antes de enviar el frame actual. */
    public synchronized void reset() {
        displayingPending = false;
    }

    public synchronized long queuedSeq() {
        return queuedSeq;
    }

    public synchronized long displayingSeq() {
        return displayingSeq;
    }
}
