package com.brixo.tronbyt.device.sync;

/**
 * Canal de avisos hacia la sesión activa de cada dispositivo, sin importar en
 * qué proceso se originó el aviso.
 */
public interface SyncNotifier {

    /** Waiter suscrito a los avisos del dispositivo. Hay que cerrarlo al terminar. */
    Waiter getWaiter(String deviceId);

    void notify(String deviceId, SyncPayload payload);
}
