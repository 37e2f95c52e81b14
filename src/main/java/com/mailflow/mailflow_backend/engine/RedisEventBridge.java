package com.mailflow.mailflow_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Relays execution events through Redis pub/sub so every instance delivers them to its own
 * STOMP subscribers, whichever instance ran the workflow.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisEventBridge implements MessageListener {

    public static final String REDIS_CHANNEL = "mailflow:execution-events";

    private final StringRedisTemplate redisTemplate;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;

    public void publish(String destination, Map<String, Object> payload) {
        try {
            String json = objectMapper.writeValueAsString(new StompMessage(destination, payload));
            redisTemplate.convertAndSend(REDIS_CHANNEL, json);
        } catch (JsonProcessingException e) {
            log.error("[RedisEventBridge] Failed to serialize event for {}", destination, e);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            StompMessage stomp = objectMapper.readValue(body, StompMessage.class);
            messagingTemplate.convertAndSend(stomp.destination(), stomp.payload());
        } catch (Exception e) {
            log.error("[RedisEventBridge] Failed to forward Redis message to STOMP", e);
        }
    }

    record StompMessage(String destination, Map<String, Object> payload) {}
}
