package me.maxih.kdeconnect_relay.relay;

import me.maxih.kdeconnect_relay.api.CoreEvent;

import java.util.Objects;

// Timer ticks share the queue with Core events so one thread applies every change.
sealed interface RelayInput
        permits RelayInput.Core, RelayInput.BurstTick, RelayInput.BackstopTick, RelayInput.EndOfStream {

    record Core(CoreEvent event) implements RelayInput {
        public Core {
            Objects.requireNonNull(event, "event");
        }
    }

    record BurstTick() implements RelayInput {
    }

    record BackstopTick() implements RelayInput {
    }

    record EndOfStream() implements RelayInput {
    }
}
