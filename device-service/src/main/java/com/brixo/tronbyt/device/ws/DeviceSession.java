package com.brixo.tronbyt.device.ws;

import com.brixo.tronbyt.device.sync.Waiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sesión lógica de un dispositivo conectado: el socket, su estado de acuses,
 * su waiter y la tarea emisora. La recepción la maneja el handler en los
 * hilos del contenedor WebSocket.
 */
public class DeviceSession {

    private static final Logger log = LoggerFactory.getLogger(DeviceSession.class);

    private final String deviceId;
    private final WebSocketSession socket;
    private final Waiter waiter;
    private final DeviceAcknowledgment ack;
    private final Runnable sender;
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean protocolStamped = new AtomicBoolean();
    private volatile Future<?> task;

    public DeviceSession(String deviceId, WebSocketSession socket, Waiter waiter, DeviceAcknowledgment ack,
            Runnable sender) {
        this.deviceId = deviceId;
        this.socket = socket;
        this.waiter = waiter;
        this.ack = ack;
        this.sender = sender;
    }

    public void start(ExecutorService executor) {
        task = executor.submit(this::runSender);
    }

    private void runSender() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            sender.run();
        } finally {
            release();
        }
    }

    /** Interrumpe la tarea emisora. Si todavía no arrancó, libera todo aquí. */
    public void cancel() {
        Future<?> current = task;
        if (current != null) {
            current.cancel(true);
        }
        if (started.compareAndSet(false, true)) {
            release();
        }
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isTerminated() {
        return terminated.getCount() == 0;
    }

    /** Cierra el socket si sigue abierto. */
    public void close(CloseStatus status) {
        if (!socket.isOpen()) {
            return;
        }
        try {
            socket.close(status);
        } catch (IOException e) {
            log.debug("Error cerrando el socket de {}: {}", deviceId, e.getMessage());
        }
    }

    /** True solo la primera vez; marca que ya se revisó la versión de protocolo. */
    boolean claimProtocolStamp() {
        return protocolStamped.compareAndSet(false, true);
    }

    private void release() {
        waiter.close();
        terminated.countDown();
    }

    public String deviceId() {
        return deviceId;
    }

    public WebSocketSession socket() {
        return socket;
    }

    public DeviceAcknowledgment ack() {
        return ack;
    }
}
