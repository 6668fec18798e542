package com.linlay.agentcoordinator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentcoordinator.store.InMemoryTtlJsonStore;
import com.linlay.agentcoordinator.store.RedisTtlJsonStore;
import com.linlay.agentcoordinator.store.TtlJsonStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "coordinator.store", name = "type", havingValue = "redis", matchIfMissing = true)
    public TtlJsonStore redisTtlJsonStore(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            StoreProperties properties
    ) {
        return new RedisTtlJsonStore(redisTemplate, objectMapper, properties.getKeyPrefix());
    }

    @Bean
    @ConditionalOnProperty(prefix = "coordinator.store", name = "type", havingValue = "memory")
    public TtlJsonStore inMemoryTtlJsonStore() {
        return new InMemoryTtlJsonStore();
    }
}
