package com.brixo.tronbyt.device.config;

import com.brixo.tronbyt.device.sync.RedisSyncNotifier;
import com.brixo.tronbyt.device.sync.SyncPayloadCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import tools.jackson.databind.ObjectMapper;

/**
 * Notifier sobre Redis pub/sub ({@code tronbyt.sync.backend=redis}), para
 * varias instancias del servicio compartiendo dispositivos.
 */
@Configuration
@ConditionalOnProperty(name = "tronbyt.sync.backend", havingValue = "redis")
public class RedisSyncConfig {

    @Bean
    public RedisMessageListenerContainer syncListenerContainer(RedisConnectionFactory connectionFactory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        return container;
    }

    @Bean
    public SyncPayloadCodec syncPayloadCodec(ObjectMapper objectMapper) {
        return new SyncPayloadCodec(objectMapper);
    }

    @Bean
    public RedisSyncNotifier redisSyncNotifier(StringRedisTemplate redis,
            RedisMessageListenerContainer syncListenerContainer, SyncPayloadCodec syncPayloadCodec) {
        return new RedisSyncNotifier(redis, syncListenerContainer, syncPayloadCodec);
    }
}
