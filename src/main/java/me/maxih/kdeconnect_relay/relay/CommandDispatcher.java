package me.maxih.kdeconnect_relay.relay;

import me.maxih.kdeconnect_relay.api.CoreChannel;
import me.maxih.kdeconnect_relay.api.CoreCommand;
import me.maxih.kdeconnect_relay.api.CoreUnavailableException;
import me.maxih.kdeconnect_relay.api.DeviceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Turns user actions into Core commands. Every call returns immediately; the outcome
 * only shows up in the log. Retries and acknowledgements are the Core's business.
 */
public class CommandDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    private final Executor executor;
    private final String pingMessage;
    private final String ringMessage;
    private volatile CoreChannel channel;

    public CommandDispatcher(Executor executor, String pingMessage, String ringMessage) {
        this.executor = executor;
        this.pingMessage = pingMessage;
        this.ringMessage = ringMessage;
    }

    public void attach(CoreChannel channel) {
        this.channel = channel;
        logger.info("Core channel attached");
    }

    public boolean isInitialized() {
        return channel != null;
    }

    public void pair(DeviceId id) {
        dispatch(new CoreCommand.Pair(id));
    }

    public void unpair(DeviceId id) {
        dispatch(new CoreCommand.Unpair(id));
    }

    public void ping(DeviceId id) {
        ping(id, pingMessage);
    }

    public void ping(DeviceId id, String message) {
        dispatch(new CoreCommand.Ping(id, message));
    }

    // On the wire this is a ping carrying the ring payload.
    public void ringDevice(DeviceId id) {
        dispatch(new CoreCommand.Ping(id, ringMessage));
    }

    public void sendFiles(DeviceId id, List<String> files) {
        if (files.isEmpty()) {
            logger.debug("No files selected for {}", id);
            return;
        }
        dispatch(new CoreCommand.SendFiles(id, files));
    }

    public void sendClipboard(DeviceId id, String content) {
        dispatch(new CoreCommand.SendClipboard(id, content));
    }

    public void requestConversations(DeviceId id) {
        dispatch(new CoreCommand.RequestConversations(id));
    }

    public void requestConversation(DeviceId id, long threadId) {
        dispatch(new CoreCommand.RequestConversation(id, threadId));
    }

    public void sendSms(DeviceId id, String phoneNumber, String message) {
        dispatch(new CoreCommand.SendSms(id, phoneNumber, message));
    }

    public void startSftpBrowsing(DeviceId id) {
        dispatch(new CoreCommand.StartSftpBrowsing(id));
    }

    public void executeCommand(DeviceId id, String commandKey) {
        dispatch(new CoreCommand.ExecuteCommand(id, commandKey));
    }

    public void requestCommandList(DeviceId id) {
        dispatch(new CoreCommand.RequestCommandList(id));
    }

    public void requestBattery(DeviceId id) {
        dispatch(new CoreCommand.RequestBattery(id));
    }

    void dispatch(CoreCommand command) {
        CoreChannel target = channel;
        if (target == null) {
            logger.warn("Core channel not initialized, dropping {}", describe(command));
            return;
        }

        try {
            executor.execute(() -> send(target, command));
        } catch (RejectedExecutionException e) {
            logger.warn("Dispatcher is shut down, dropping {}", describe(command));
        }
    }

    private static void send(CoreChannel target, CoreCommand command) {
        try {
            target.send(command);
            logger.debug("Sent {}", describe(command));
        } catch (CoreUnavailableException e) {
            logger.warn("Core unavailable, {} not delivered: {}", describe(command), e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Failed to send {}", describe(command), e);
        }
    }

    static String describe(CoreCommand command) {
        return command.getClass().getSimpleName() + " to " + command.deviceId();
    }
}
