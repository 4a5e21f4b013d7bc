package me.maxih.kdeconnect_relay.api;

import java.util.Optional;

@FunctionalInterface
public interface CoreEventSource {

    // Empty once the Core has closed the stream for good.
    Optional<CoreEvent> next() throws InterruptedException;
}
