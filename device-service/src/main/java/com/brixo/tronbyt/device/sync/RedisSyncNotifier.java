package com.brixo.tronbyt.device.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Notifier sobre Redis pub/sub para varios procesos detrás de un balanceador.
 * Cada dispositivo tiene su canal {@code tronbyt:sync:<id>}; el proceso se
 * suscribe mientras tenga al menos un waiter abierto para ese dispositivo.
 */
public class RedisSyncNotifier extends LocalSyncNotifier {

    private static final Logger log = LoggerFactory.getLogger(RedisSyncNotifier.class);
    static final String CHANNEL_PREFIX = "tronbyt:sync:";

    private final StringRedisTemplate redis;
    private final RedisMessageListenerContainer container;
    private final SyncPayloadCodec codec;
    private final Map<String, MessageListener> listeners = new ConcurrentHashMap<>();

    public RedisSyncNotifier(StringRedisTemplate redis, RedisMessageListenerContainer container,
            SyncPayloadCodec codec) {
        this.redis = redis;
        this.container = container;
        this.codec = codec;
    }

    @Override
    public void notify(String deviceId, SyncPayload payload) {
        redis.convertAndSend(channel(deviceId), codec.encode(payload));
    }

    @Override
    protected void onChannelOpened(String deviceId) {
        MessageListener listener = (message, pattern) -> onMessage(deviceId, message);
        listeners.put(deviceId, listener);
        container.addMessageListener(listener, new ChannelTopic(channel(deviceId)));
        log.debug("Suscrito a {}", channel(deviceId));
    }

    @Override
    protected void onChannelClosed(String deviceId) {
        MessageListener listener = listeners.remove(deviceId);
        if (listener != null) {
            container.removeMessageListener(listener, new ChannelTopic(channel(deviceId)));
            log.debug("Desuscrito de {}", channel(deviceId));
        }
    }

    private void onMessage(String deviceId, Message message) {
        String raw = new String(message.getBody(), StandardCharsets.UTF_8);
        try {
            deliver(deviceId, codec.decode(raw));
        } catch (RuntimeException e) {
            log.warn("Aviso inválido en {}: {}", channel(deviceId), e.getMessage());
        }
    }

    static String channel(String deviceId) {
        return CHANNEL_PREFIX + deviceId;
    }
}
