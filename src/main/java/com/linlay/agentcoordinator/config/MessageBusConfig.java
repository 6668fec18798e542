package com.linlay.agentcoordinator.config;

import com.linlay.agentcoordinator.bus.InMemoryMessageBus;
import com.linlay.agentcoordinator.bus.KafkaMessageBus;
import com.linlay.agentcoordinator.bus.MessageBus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;

@Configuration
public class MessageBusConfig {

    @Bean
    @ConditionalOnProperty(prefix = "coordinator.bus", name = "type", havingValue = "kafka", matchIfMissing = true)
    public MessageBus kafkaMessageBus(
            KafkaTemplate<String, String> kafkaTemplate,
            ConsumerFactory<String, String> consumerFactory,
            BusProperties properties
    ) {
        return new KafkaMessageBus(kafkaTemplate, consumerFactory, properties);
    }

    @Bean
    @ConditionalOnProperty(prefix = "coordinator.bus", name = "type", havingValue = "memory")
    public MessageBus inMemoryMessageBus() {
        return new InMemoryMessageBus();
    }
}
