package com.forge.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forge.config.ForgeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.util.Objects;

/**
 * Publishes lifecycle events as JSON on a Redis pub/sub channel. Subscribe it to the
 * {@link ExecutionEventBus}; publish failures surface as exceptions and are logged by the bus.
 */
public final class RedisExecutionEventPublisher implements ExecutionEventListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisExecutionEventPublisher.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JedisPool pool;
    private final String channel;

    public RedisExecutionEventPublisher(ForgeConfig config) {
        this(new JedisPool(new JedisPoolConfig(), Objects.requireNonNull(config, "config").getCacheHost(),
                config.getCachePort()), config.getEventsChannel());
        log.info("Redis event publisher connected to {}:{} channel={}", config.getCacheHost(), config.getCachePort(), channel);
    }

    public RedisExecutionEventPublisher(JedisPool pool, String channel) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public void onEvent(ExecutionEvent event) {
        String json = toJson(event);
        try (var jedis = pool.getResource()) {
            long receivers = jedis.publish(channel, json);
            log.debug("Published event to Redis | channel={} | event={} | executionId={} | receivers={}",
                    channel, event.getName(), event.getExecutionId(), receivers);
        }
    }

    /** JSON form sent on the channel: {@code event}, {@code workflowId}, {@code executionId}, {@code payload}, {@code timestamp}. */
    public static String toJson(ExecutionEvent event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize event " + event.getName() + ": " + e.getOriginalMessage(), e);
        }
    }

    public String getChannel() {
        return channel;
    }

    @Override
    public void close() {
        pool.close();
    }
}
