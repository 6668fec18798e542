package com.linlay.agentcoordinator.bus;

import com.linlay.agentcoordinator.config.BusProperties;
import org.springframework.stereotype.Component;

/**
 * Topic names, namespaced by {@code coordinator.bus.topic-prefix} so several environments can
 * share one broker.
 */
@Component
public class BusTopics {

    public static final String TEXT_TO_SCENE = "text-to-scene";
    public static final String ASSET_GENERATION = "asset-generation";
    public static final String AR_RENDERING = "ar-rendering";
    public static final String SENTIMENT_ANALYSIS = "sentiment-analysis";
    public static final String CONTEXT_UPDATE = "context-update";
    public static final String INTER_AGENT = "inter-agent";
    public static final String AGENT_REGISTRY = "agent-registry";

    private static final String RESULT_SUFFIX = "-results";

    private final String prefix;

    public BusTopics(BusProperties properties) {
        String configured = properties.getTopicPrefix();
        this.prefix = configured == null ? "" : configured.trim();
    }

    public String resolve(String topic) {
        return prefix + topic;
    }

    /**
     * Topic on which agents publish the outcome of jobs taken from {@code jobTopic}.
     */
    public String resultsOf(String jobTopic) {
        return resolve(jobTopic + RESULT_SUFFIX);
    }

    public String prefix() {
        return prefix;
    }
}
