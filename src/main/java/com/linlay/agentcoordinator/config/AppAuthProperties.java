package com.linlay.agentcoordinator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "coordinator.auth")
public class AppAuthProperties {

    private boolean enabled = true;
    private String clientTokenSecret;
    private String issuer;
    private String agentApiKey;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getClientTokenSecret() {
        return clientTokenSecret;
    }

    public void setClientTokenSecret(String clientTokenSecret) {
        this.clientTokenSecret = clientTokenSecret;
    }

    public String getIssuer() {
        return issuer;
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }

    public String getAgentApiKey() {
        return agentApiKey;
    }

    public void setAgentApiKey(String agentApiKey) {
        this.agentApiKey = agentApiKey;
    }
}
