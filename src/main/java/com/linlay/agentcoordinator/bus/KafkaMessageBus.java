package com.linlay.agentcoordinator.bus;

import com.linlay.agentcoordinator.config.BusProperties;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Kafka-backed bus. Every subscription owns one polling thread and one consumer; offsets are
 * committed after the batch has been handed to the listener, so delivery is at-least-once.
 */
public class KafkaMessageBus implements MessageBus, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(KafkaMessageBus.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ConsumerFactory<String, String> consumerFactory;
    private final BusProperties properties;
    private final List<TopicConsumer> consumers = new CopyOnWriteArrayList<>();

    public KafkaMessageBus(
            KafkaTemplate<String, String> kafkaTemplate,
            ConsumerFactory<String, String> consumerFactory,
            BusProperties properties
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.consumerFactory = consumerFactory;
        this.properties = properties;
    }

    @Override
    public void publish(String topic, String key, String payload) {
        long timeoutMs = Math.max(100L, properties.getPublishTimeoutMs());
        try {
            kafkaTemplate.send(topic, key, payload).get(timeoutMs, TimeUnit.MILLISECONDS);
            log.debug("Published message to {} key={}", topic, key);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new MessageBusException("Interrupted while publishing to " + topic, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            throw new MessageBusException("Failed to publish to " + topic + ": " + cause.getMessage(), cause);
        } catch (TimeoutException ex) {
            throw new MessageBusException("Timed out after " + timeoutMs + "ms publishing to " + topic, ex);
        } catch (RuntimeException ex) {
            throw new MessageBusException("Failed to publish to " + topic + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public BusSubscription subscribe(String topic, java.util.function.Consumer<String> listener) {
        Consumer<String, String> consumer = consumerFactory.createConsumer(
                properties.getConsumerGroup(),
                properties.getConsumerGroup() + "-" + topic,
                null
        );
        TopicConsumer topicConsumer = new TopicConsumer(topic, consumer, listener);
        consumers.add(topicConsumer);
        topicConsumer.start();
        return topicConsumer;
    }

    @Override
    public void destroy() {
        for (TopicConsumer consumer : consumers) {
            consumer.close();
        }
        consumers.clear();
    }

    private final class TopicConsumer implements BusSubscription, Runnable {

        private final String topic;
        private final Consumer<String, String> consumer;
        private final java.util.function.Consumer<String> listener;
        private final Thread thread;
        private volatile boolean active = true;

        private TopicConsumer(String topic, Consumer<String, String> consumer, java.util.function.Consumer<String> listener) {
            this.topic = topic;
            this.consumer = consumer;
            this.listener = listener;
            this.thread = new Thread(this, "bus-consumer-" + topic);
            this.thread.setDaemon(true);
        }

        private void start() {
            thread.start();
        }

        @Override
        public void run() {
            Duration pollTimeout = Duration.ofMillis(Math.max(50L, properties.getPollTimeoutMs()));
            try {
                consumer.subscribe(List.of(topic));
                log.info("Bus consumer started for topic {}", topic);
                while (active) {
                    try {
                        pollOnce(pollTimeout);
                    } catch (WakeupException ex) {
                        if (active) {
                            log.warn("Unexpected wakeup of bus consumer for topic {}", topic, ex);
                        }
                    } catch (RuntimeException ex) {
                        if (!active) {
                            break;
                        }
                        log.warn("Bus consumer for topic {} failed, retrying in {}ms", topic, pollTimeout.toMillis(), ex);
                        backOff(pollTimeout);
                    }
                }
            } catch (RuntimeException ex) {
                log.error("Bus consumer for topic {} could not subscribe", topic, ex);
            } finally {
                active = false;
                consumer.close();
                consumers.remove(this);
                log.info("Bus consumer stopped for topic {}", topic);
            }
        }

        private void pollOnce(Duration pollTimeout) {
            ConsumerRecords<String, String> records = consumer.poll(pollTimeout);
            if (records.isEmpty()) {
                return;
            }
            for (ConsumerRecord<String, String> record : records) {
                deliver(record);
            }
            consumer.commitSync();
        }

        private void backOff(Duration pollTimeout) {
            try {
                Thread.sleep(pollTimeout.toMillis());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                active = false;
            }
        }

        private void deliver(ConsumerRecord<String, String> record) {
            String value = record.value();
            if (value == null) {
                log.warn("Skip empty record on {} offset={}", topic, record.offset());
                return;
            }
            try {
                listener.accept(value);
            } catch (RuntimeException ex) {
                log.warn("Listener failed on {} offset={}, continue polling", topic, record.offset(), ex);
            }
        }

        @Override
        public String topic() {
            return topic;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            if (!active) {
                return;
            }
            active = false;
            consumer.wakeup();
        }
    }
}
