package com.offy.competition.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.offy.competition.model.LeaderboardEntry;
import com.offy.competition.repository.LeaderboardCacheRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.util.List;
import java.util.Optional;

/**
 * Caches computed global leaderboards as JSON strings in Redis. Every failure degrades to a
 * cache miss; the leaderboard is always recomputable from the logs.
 */
@Repository
public class JedisLeaderboardCacheRepository implements LeaderboardCacheRepository {

    private static final Logger logger = LoggerFactory.getLogger(JedisLeaderboardCacheRepository.class);
    private static final TypeReference<List<LeaderboardEntry>> ENTRY_LIST = new TypeReference<List<LeaderboardEntry>>() {};

    private final ObjectMapper objectMapper;
    private JedisPool jedisPool;
    private volatile boolean available = false;

    @Value("${redis.host:localhost}")
    private String redisHost;

    @Value("${redis.port:6379}")
    private int redisPort;

    @Value("${redis.password:}")
    private String redisPassword;

    @Value("${redis.ssl:false}")
    private boolean redisSsl;

    @Value("${redis.timeout:2000}")
    private int timeout;

    public JedisLeaderboardCacheRepository() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
    }

    @PostConstruct
    public void init() {
        try {
            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(32);
            poolConfig.setMaxIdle(8);
            poolConfig.setMinIdle(2);
            poolConfig.setTestOnBorrow(true);

            DefaultJedisClientConfig.Builder clientConfigBuilder = DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis(timeout)
                .socketTimeoutMillis(timeout);

            if (redisSsl) {
                clientConfigBuilder.ssl(true);
            }

            if (redisPassword != null && !redisPassword.isEmpty()) {
                clientConfigBuilder.password(redisPassword);
            }

            jedisPool = new JedisPool(poolConfig, new HostAndPort(redisHost, redisPort), clientConfigBuilder.build());

            try (Jedis jedis = jedisPool.getResource()) {
                jedis.ping();
                available = true;
                logger.info("Connected to Redis at {}:{}{}", redisHost, redisPort, redisSsl ? " (SSL enabled)" : "");
            }
        } catch (Exception e) {
            logger.warn("Redis unavailable at {}:{}, leaderboard cache disabled: {}", redisHost, redisPort, e.getMessage());
            available = false;
        }
    }

    @PreDestroy
    public void destroy() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
        }
    }

    @Override
    public boolean isAvailable() {
        if (!available || jedisPool == null) {
            return false;
        }

        try (Jedis jedis = jedisPool.getResource()) {
            jedis.ping();
            return true;
        } catch (Exception e) {
            logger.warn("Redis ping failed, marking cache unavailable: {}", e.getMessage());
            available = false;
            return false;
        }
    }

    @Override
    public Optional<List<LeaderboardEntry>> get(String key) {
        if (key == null || key.trim().isEmpty() || !isAvailable()) {
            return Optional.empty();
        }

        try (Jedis jedis = jedisPool.getResource()) {
            String json = jedis.get(key);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(deserialize(json));
        } catch (Exception e) {
            logger.warn("Failed to read leaderboard cache key {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, List<LeaderboardEntry> entries, int ttlSeconds) {
        if (key == null || key.trim().isEmpty()) {
            throw new IllegalArgumentException("Cache key cannot be null or empty");
        }
        if (ttlSeconds <= 0 || !isAvailable()) {
            return;
        }

        try (Jedis jedis = jedisPool.getResource()) {
            jedis.setex(key, ttlSeconds, serialize(entries));
        } catch (Exception e) {
            logger.warn("Failed to write leaderboard cache key {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void evict(String key) {
        if (key == null || key.trim().isEmpty() || !isAvailable()) {
            return;
        }

        try (Jedis jedis = jedisPool.getResource()) {
            jedis.del(key);
        } catch (Exception e) {
            logger.warn("Failed to evict leaderboard cache key {}: {}", key, e.getMessage());
        }
    }

    String serialize(List<LeaderboardEntry> entries) throws JsonProcessingException {
        return objectMapper.writeValueAsString(entries);
    }

    List<LeaderboardEntry> deserialize(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, ENTRY_LIST);
    }
}
