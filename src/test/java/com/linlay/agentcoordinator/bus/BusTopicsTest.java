package com.linlay.agentcoordinator.bus;

import com.linlay.agentcoordinator.config.BusProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BusTopicsTest {

    @Test
    void shouldPrefixJobAndResultTopics() {
        BusProperties properties = new BusProperties();
        properties.setTopicPrefix(" staging- ");
        BusTopics topics = new BusTopics(properties);

        assertThat(topics.resolve(BusTopics.TEXT_TO_SCENE)).isEqualTo("staging-text-to-scene");
        assertThat(topics.resultsOf(BusTopics.AR_RENDERING)).isEqualTo("staging-ar-rendering-results");
        assertThat(topics.prefix()).isEqualTo("staging-");
    }

    @Test
    void defaultPrefixShouldApply() {
        BusTopics topics = new BusTopics(new BusProperties());

        assertThat(topics.resolve(BusTopics.AGENT_REGISTRY)).isEqualTo("agent-coordinator-agent-registry");
    }
}
