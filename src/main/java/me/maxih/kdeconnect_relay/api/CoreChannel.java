package me.maxih.kdeconnect_relay.api;

@FunctionalInterface
public interface CoreChannel {
    void send(CoreCommand command) throws CoreUnavailableException;
}
