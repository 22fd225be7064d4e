package com.brixo.tronbyt.device.ws;

/**
 * Cómo terminó la espera del emisor después de enviar un frame.
 */
public enum AckWaitResult {
    /** Llegó el acuse "displaying". */
    DISPLAYED,
    /** Llegó una imagen push por el notifier. */
    PUSHED,
    /** Un refresco dejó una imagen efímera pendiente. */
    EPHEMERAL,
    /** No hubo acuse a tiempo; no es un error, se avanza igual. */
    TIMEOUT
}
