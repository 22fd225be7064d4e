package com.brixo.tronbyt.device.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Notifier dentro del proceso. Cada dispositivo tiene un canal con los
 * waiters abiertos; el canal se crea con el primer waiter y se elimina al
 * cerrarse el último.
 */
@Component
@ConditionalOnProperty(name = "tronbyt.sync.backend", havingValue = "local", matchIfMissing = true)
public class LocalSyncNotifier implements SyncNotifier {

    private static final Logger log = LoggerFactory.getLogger(LocalSyncNotifier.class);

    private final Map<String, Set<ChannelWaiter>> channels = new ConcurrentHashMap<>();
    private final Object membership = new Object();

    @Override
    public Waiter getWaiter(String deviceId) {
        ChannelWaiter waiter = new ChannelWaiter(deviceId);
        synchronized (membership) {
            Set<ChannelWaiter> waiters = channels.get(deviceId);
            if (waiters == null) {
                waiters = new CopyOnWriteArraySet<>();
                channels.put(deviceId, waiters);
                onChannelOpened(deviceId);
            }
            waiters.add(waiter);
        }
        return waiter;
    }

    @Override
    public void notify(String deviceId, SyncPayload payload) {
        deliver(deviceId, payload);
    }

    /** Entrega el aviso a todos los waiters locales del dispositivo. */
    protected void deliver(String deviceId, SyncPayload payload) {
        Set<ChannelWaiter> waiters = channels.get(deviceId);
        if (waiters == null || waiters.isEmpty()) {
            log.debug("Sin sesión activa para {}, aviso descartado", deviceId);
            return;
        }
        for (ChannelWaiter waiter : waiters) {
            waiter.deliver(payload);
        }
    }

    /** Cantidad de waiters abiertos para el dispositivo. */
    public int waiterCount(String deviceId) {
        Set<ChannelWaiter> waiters = channels.get(deviceId);
        return waiters == null ? 0 : waiters.size();
    }

    /**
     * Se llama al abrirse el primer waiter de un dispositivo. Este hook y
     * {@link #onChannelClosed} corren dentro del lock de membresía.
     */
    protected void onChannelOpened(String deviceId) {
    }

    /** Se llama al cerrarse el último waiter de un dispositivo. */
    protected void onChannelClosed(String deviceId) {
    }

    private void release(ChannelWaiter waiter) {
        synchronized (membership) {
            Set<ChannelWaiter> waiters = channels.get(waiter.deviceId);
            if (waiters != null && waiters.remove(waiter) && waiters.isEmpty()) {
                channels.remove(waiter.deviceId);
                onChannelClosed(waiter.deviceId);
            }
        }
    }

    private final class ChannelWaiter extends AbstractWaiter {

        private final String deviceId;

        private ChannelWaiter(String deviceId) {
            this.deviceId = deviceId;
        }

        @Override
        protected void onClose() {
            release(this);
        }
    }
}
