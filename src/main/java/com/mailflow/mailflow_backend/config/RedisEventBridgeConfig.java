package com.mailflow.mailflow_backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailflow.mailflow_backend.engine.RedisEventBridge;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Active only with mailflow.events.redis-bridge.enabled=true, so a single instance runs without Redis.
 */
@Configuration
@ConditionalOnProperty(prefix = "mailflow.events.redis-bridge", name = "enabled", havingValue = "true")
public class RedisEventBridgeConfig {

    @Bean
    public RedisEventBridge redisEventBridge(
            StringRedisTemplate redisTemplate,
            SimpMessagingTemplate messagingTemplate,
            ObjectMapper objectMapper) {
        return new RedisEventBridge(redisTemplate, messagingTemplate, objectMapper);
    }

    @Bean
    public RedisMessageListenerContainer redisEventListenerContainer(
            RedisConnectionFactory connectionFactory,
            RedisEventBridge bridge) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(bridge, new ChannelTopic(RedisEventBridge.REDIS_CHANNEL));
        return container;
    }
}
