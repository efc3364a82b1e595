package io.pagekeys.jobs;

@FunctionalInterface
public interface DispatcherFactory {
    Dispatcher create(String queueName, int maxWorkers, int queueCapacity);
}
