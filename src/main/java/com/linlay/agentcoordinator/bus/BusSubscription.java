package com.linlay.agentcoordinator.bus;

public interface BusSubscription extends AutoCloseable {

    String topic();

    boolean isActive();

    @Override
    void close();
}
