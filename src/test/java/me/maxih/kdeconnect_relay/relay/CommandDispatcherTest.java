package me.maxih.kdeconnect_relay.relay;

import me.maxih.kdeconnect_relay.api.CoreCommand;
import me.maxih.kdeconnect_relay.api.CoreUnavailableException;
import me.maxih.kdeconnect_relay.api.DeviceId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class CommandDispatcherTest {
    private static final DeviceId ID = DeviceId.of("dev1");

    private final List<CoreCommand> sent = new ArrayList<>();

    private CommandDispatcher attachedDispatcher() {
        CommandDispatcher dispatcher = new CommandDispatcher(Runnable::run, "ping!", "ring!");
        dispatcher.attach(sent::add);
        return dispatcher;
    }

    @Test
    void dispatch_notInitialized() {
        CommandDispatcher dispatcher = new CommandDispatcher(Runnable::run, "ping!", "ring!");

        assertFalse(dispatcher.isInitialized());
        assertDoesNotThrow(() -> dispatcher.pair(ID));
    }

    @Test
    void dispatch_oneCommandPerAction() {
        CommandDispatcher dispatcher = attachedDispatcher();
        dispatcher.pair(ID);
        dispatcher.unpair(ID);
        dispatcher.sendClipboard(ID, "copied");
        dispatcher.requestConversations(ID);
        dispatcher.requestConversation(ID, 7);
        dispatcher.sendSms(ID, "5551234567", "hi");
        dispatcher.startSftpBrowsing(ID);
        dispatcher.executeCommand(ID, "lock");
        dispatcher.requestCommandList(ID);
        dispatcher.requestBattery(ID);

        assertEquals(List.of(
                new CoreCommand.Pair(ID),
                new CoreCommand.Unpair(ID),
                new CoreCommand.SendClipboard(ID, "copied"),
                new CoreCommand.RequestConversations(ID),
                new CoreCommand.RequestConversation(ID, 7),
                new CoreCommand.SendSms(ID, "5551234567", "hi"),
                new CoreCommand.StartSftpBrowsing(ID),
                new CoreCommand.ExecuteCommand(ID, "lock"),
                new CoreCommand.RequestCommandList(ID),
                new CoreCommand.RequestBattery(ID)
        ), sent);
    }

    @Test
    void ping_defaultMessage() {
        attachedDispatcher().ping(ID);

        assertEquals(List.of(new CoreCommand.Ping(ID, "ping!")), sent);
    }

    @Test
    void ringDevice_usesRingPayload() {
        CommandDispatcher dispatcher = attachedDispatcher();
        dispatcher.ringDevice(ID);
        dispatcher.ping(ID);

        assertEquals(new CoreCommand.Ping(ID, "ring!"), sent.get(0));
        assertNotEquals(sent.get(0), sent.get(1));
    }

    @Test
    void sendFiles_emptySelection() {
        CommandDispatcher dispatcher = attachedDispatcher();
        dispatcher.sendFiles(ID, List.of());
        dispatcher.sendFiles(ID, List.of("/tmp/a.jpg"));

        assertEquals(List.of(new CoreCommand.SendFiles(ID, List.of("/tmp/a.jpg"))), sent);
    }

    @Test
    void send_coreUnavailableIsNotPropagated() {
        CommandDispatcher dispatcher = new CommandDispatcher(Runnable::run, "ping!", "ring!");
        dispatcher.attach(command -> {
            throw new CoreUnavailableException("bus closed");
        });

        assertDoesNotThrow(() -> dispatcher.ping(ID));
    }

    @Test
    void send_runtimeFailureIsNotPropagated() {
        CommandDispatcher dispatcher = new CommandDispatcher(Runnable::run, "ping!", "ring!");
        dispatcher.attach(command -> {
            throw new IllegalStateException("boom");
        });

        assertDoesNotThrow(() -> dispatcher.unpair(ID));
    }

    @Test
    void dispatch_executorShutDown() {
        Executor rejecting = command -> {
            throw new RejectedExecutionException();
        };
        CommandDispatcher dispatcher = new CommandDispatcher(rejecting, "ping!", "ring!");
        dispatcher.attach(sent::add);

        assertDoesNotThrow(() -> dispatcher.pair(ID));
        assertTrue(sent.isEmpty());
    }

    @Test
    void describe_namesCommandAndDevice() {
        assertEquals("Pair to dev1", CommandDispatcher.describe(new CoreCommand.Pair(ID)));
    }
}
