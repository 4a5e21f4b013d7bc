package me.maxih.kdeconnect_relay.api;

import java.util.List;
import java.util.Objects;

public sealed interface CoreCommand
        permits CoreCommand.Pair,
                CoreCommand.Unpair,
                CoreCommand.Ping,
                CoreCommand.SendFiles,
                CoreCommand.SendClipboard,
                CoreCommand.RequestConversations,
                CoreCommand.RequestConversation,
                CoreCommand.SendSms,
                CoreCommand.StartSftpBrowsing,
                CoreCommand.ExecuteCommand,
                CoreCommand.RequestCommandList,
                CoreCommand.RequestBattery {

    DeviceId deviceId();

    record Pair(DeviceId deviceId) implements CoreCommand {
        public Pair {
            Objects.requireNonNull(deviceId, "deviceId");
        }
    }

    record Unpair(DeviceId deviceId) implements CoreCommand {
        public Unpair {
            Objects.requireNonNull(deviceId, "deviceId");
        }
    }

    record Ping(DeviceId deviceId, String message) implements CoreCommand {
        public Ping {
            Objects.requireNonNull(deviceId, "deviceId");
            message = message == null ? "" : message;
        }
    }

    record SendFiles(DeviceId deviceId, List<String> files) implements CoreCommand {
        public SendFiles {
            Objects.requireNonNull(deviceId, "deviceId");
            files = List.copyOf(Objects.requireNonNull(files, "files"));
        }
    }

    record SendClipboard(DeviceId deviceId, String content) implements CoreCommand {
        public SendClipboard {
            Objects.requireNonNull(deviceId, "deviceId");
            content = content == null ? "" : content;
        }
    }

    record RequestConversations(DeviceId deviceId) implements CoreCommand {
        public RequestConversations {
            Objects.requireNonNull(deviceId, "deviceId");
        }
    }

    record RequestConversation(DeviceId deviceId, long threadId) implements CoreCommand {
        public RequestConversation {
            Objects.requireNonNull(deviceId, "deviceId");
        }
    }

    record SendSms(DeviceId deviceId, String phoneNumber, String message) implements CoreCommand {
        public SendSms {
            Objects.requireNonNull(deviceId, "deviceId");
            Objects.requireNonNull(phoneNumber, "phoneNumber");
            Objects.requireNonNull(message, "message");
        }
    }

    record StartSftpBrowsing(DeviceId deviceId) implements CoreCommand {
        public StartSftpBrowsing {
            Objects.requireNonNull(deviceId, "deviceId");
        }
    }

    record ExecuteCommand(DeviceId deviceId, String commandKey) implements CoreCommand {
        public ExecuteCommand {
            Objects.requireNonNull(deviceId, "deviceId");
            Objects.requireNonNull(commandKey, "commandKey");
        }
    }

    record RequestCommandList(DeviceId deviceId) implements CoreCommand {
        public RequestCommandList {
            Objects.requireNonNull(deviceId, "deviceId");
        }
    }

    record RequestBattery(DeviceId deviceId) implements CoreCommand {
        public RequestBattery {
            Objects.requireNonNull(deviceId, "deviceId");
        }
    }
}
