package me.maxih.kdeconnect_relay.api;

public enum Capability {
    BATTERY,
    CLIPBOARD,
    CONTACTS,
    FINDMYPHONE,
    LOCKDEVICE,
    MPRIS,
    PING,
    PRESENTER,
    REMOTE_KEYBOARD,
    RUNCOMMAND,
    SFTP,
    SHARE,
    SMS,
    VIRTUALMONITOR
}
