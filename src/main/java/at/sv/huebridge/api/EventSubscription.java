package at.sv.huebridge.api;

@FunctionalInterface
public interface EventSubscription {
    void close();
}
