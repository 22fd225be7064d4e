package com.brixo.tronbyt.device.ws;

import com.brixo.tronbyt.device.exception.DeviceNotFoundException;
import com.brixo.tronbyt.device.model.Device;
import com.brixo.tronbyt.device.model.Frame;
import com.brixo.tronbyt.device.repository.DeviceStore;
import com.brixo.tronbyt.device.service.DisplayModes;
import com.brixo.tronbyt.device.service.FrameFactory;
import com.brixo.tronbyt.device.service.RotationService;
import com.brixo.tronbyt.device.service.WebpCache;
import com.brixo.tronbyt.device.sync.SyncPayload;
import com.brixo.tronbyt.device.sync.Waiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Bucle emisor de una sesión WebSocket. Por cada frame envía
 * {@code dwell_secs}, {@code brightness} si cambió, la imagen binaria y
 * {@code immediate} después de los bytes; luego espera el acuse
 * "displaying", un aviso del notifier o el timeout, lo que ocurra primero.
 */
public class FrameSender implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(FrameSender.class);

    private final String deviceId;
    private final WebSocketSession socket;
    private final Waiter waiter;
    private final DeviceAcknowledgment ack;
    private final Collaborators collaborators;
    private final Duration minAckTimeout;
    private final Duration pollInterval;

    private Integer lastBrightness;
    private Device device;

    /** Resultado de {@link #awaitAck}; {@code image} solo para {@link AckWaitResult#PUSHED}. */
    record AckWait(AckWaitResult result, byte[] image) {
    }

    /** Servicios compartidos que usa el emisor. */
    public record Collaborators(RotationService rotationService, DeviceStore deviceStore,
            DisplayModes displayModes, WebpCache webpCache, FrameFactory frameFactory,
            DeviceMessageCodec codec) {
    }

    public FrameSender(String deviceId, WebSocketSession socket, Waiter waiter, DeviceAcknowledgment ack,
            Collaborators collaborators, Duration minAckTimeout, Duration pollInterval) {
        this.deviceId = deviceId;
        this.socket = socket;
        this.waiter = waiter;
        this.ack = ack;
        this.collaborators = collaborators;
        this.minAckTimeout = minAckTimeout;
        this.pollInterval = pollInterval;
    }

    @Override
    public void run() {
        try {
            device = reload();
            Frame frame = collaborators.rotationService().nextFrame(device, true);
            while (socket.isOpen() && !Thread.currentThread().isInterrupted()) {
                ack.reset();
                send(frame);
                frame = awaitNextFrame(frame);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Emisor de {} cancelado", deviceId);
        } catch (IOException e) {
            log.info("Conexión con {} cerrada durante el envío: {}", deviceId, e.getMessage());
        } catch (DeviceNotFoundException e) {
            log.warn("{} ya no existe, se cierra la sesión", deviceId);
        } catch (RuntimeException e) {
            log.error("Error en el emisor de {}", deviceId, e);
        }
    }

    void send(Frame frame) throws IOException {
        sendText(new ServerMessage.DwellSecs(frame.dwellSecs()));
        if (lastBrightness == null || lastBrightness != frame.brightness()) {
            sendBrightness(frame.brightness());
        }
        socket.sendMessage(new BinaryMessage(frame.image()));
        if (frame.immediate()) {
            sendText(new ServerMessage.Immediate());
        }
    }

    /**
     * Espera el acuse, un aviso o el timeout y devuelve el frame a enviar a
     * continuación.
     */
    Frame awaitNextFrame(Frame current) throws InterruptedException, IOException {
        device = reload();
        Duration timeout = ackTimeout(device, current.dwellSecs());
        AckWait outcome = awaitAck(timeout);
        return switch (outcome.result()) {
            case PUSHED -> {
                log.debug("Imagen push para {}", deviceId);
                yield collaborators.frameFactory().immediate(outcome.image(),
                        collaborators.displayModes().effectiveBrightness(device));
            }
            case TIMEOUT -> {
                log.debug("{} no confirmó en {}s", deviceId, timeout.toSeconds());
                yield collaborators.rotationService().nextFrame(reload(), true);
            }
            case DISPLAYED, EPHEMERAL -> collaborators.rotationService().nextFrame(reload(), true);
        };
    }

    /**
     * Multiplexa acuses y avisos del notifier hasta el timeout. Un aviso
     * recibido se atiende antes que el acuse que llegó en la misma vuelta; un
     * aviso de brillo se aplica sin terminar la espera.
     */
    AckWait awaitAck(Duration timeout) throws InterruptedException, IOException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return new AckWait(AckWaitResult.TIMEOUT, null);
            }
            Optional<SyncPayload> payload = waiter.await(
                    Duration.ofNanos(Math.min(remaining, pollInterval.toNanos())));
            if (payload.isPresent()) {
                Optional<AckWait> outcome = handle(payload.get());
                if (outcome.isPresent()) {
                    return outcome.get();
                }
            }
            if (ack.consumeDisplaying()) {
                return new AckWait(AckWaitResult.DISPLAYED, null);
            }
        }
    }

    private Optional<AckWait> handle(SyncPayload received) throws IOException {
        if (received instanceof SyncPayload.Image image) {
            return Optional.of(new AckWait(AckWaitResult.PUSHED, image.bytes()));
        }
        if (received instanceof SyncPayload.Brightness brightness) {
            sendBrightness(brightness.value());
            return Optional.empty();
        }
        // Refresh: la configuración cambió fuera de la sesión
        device = reload();
        int effective = collaborators.displayModes().effectiveBrightness(device);
        if (lastBrightness == null || lastBrightness != effective) {
            sendBrightness(effective);
        }
        if (collaborators.webpCache().hasEphemeral(deviceId)) {
            return Optional.of(new AckWait(AckWaitResult.EPHEMERAL, null));
        }
        return Optional.empty();
    }

    /**
     * {@code max(2 * dwell, mínimo)} si el firmware confirma frames, es decir
     * si ya registró {@code protocol_version}; si no, el propio dwell.
     */
    Duration ackTimeout(Device device, int dwellSecs) {
        Duration dwell = Duration.ofSeconds(Math.max(1, dwellSecs));
        if (device.getInfo().getProtocolVersion() == null) {
            return dwell;
        }
        Duration doubled = dwell.multipliedBy(2);
        return doubled.compareTo(minAckTimeout) > 0 ? doubled : minAckTimeout;
    }

    private void sendBrightness(int brightness) throws IOException {
        sendText(new ServerMessage.Brightness(brightness));
        lastBrightness = brightness;
    }

    private void sendText(ServerMessage message) throws IOException {
        socket.sendMessage(new TextMessage(collaborators.codec().encode(message)));
    }

    private Device reload() {
        return collaborators.deviceStore().findById(deviceId)
                .orElseThrow(() -> DeviceNotFoundException.device(deviceId));
    }
}
