package com.linlay.agentcoordinator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

public class RedisTtlJsonStore implements TtlJsonStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisTtlJsonStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public void put(String key, Map<String, Object> value, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new StoreException("Cannot serialize value for key " + key, ex);
        }
        try {
            redisTemplate.opsForValue().set(keyPrefix + key, json, ttl);
        } catch (DataAccessException ex) {
            throw new StoreException("Redis write failed for key " + key, ex);
        }
    }

    @Override
    public Optional<Map<String, Object>> get(String key) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(keyPrefix + key);
        } catch (DataAccessException ex) {
            throw new StoreException("Redis read failed for key " + key, ex);
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, MAP_TYPE));
        } catch (JsonProcessingException ex) {
            throw new StoreException("Stored value for key " + key + " is not a JSON object", ex);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.delete(keyPrefix + key));
        } catch (DataAccessException ex) {
            throw new StoreException("Redis delete failed for key " + key, ex);
        }
    }
}
