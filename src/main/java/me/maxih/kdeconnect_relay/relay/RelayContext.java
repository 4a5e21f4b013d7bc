package me.maxih.kdeconnect_relay.relay;

import me.maxih.kdeconnect_relay.api.CoreChannel;
import me.maxih.kdeconnect_relay.api.CoreEventSource;
import me.maxih.kdeconnect_relay.api.DeviceId;
import me.maxih.kdeconnect_relay.sms.SmsReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Owns every relay component and the threads behind them. One instance per applet; all
 * components reach each other through it instead of through globals.
 */
public class RelayContext implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RelayContext.class);

    private final ExecutorService dispatchExecutor;
    private final DeviceCache devices;
    private final PairingBurstWindow burstWindow;
    private final CommandDispatcher commands;
    private final SmsReconciler sms;
    private final EventRelay relay;
    private final RefreshScheduler scheduler;

    public RelayContext() {
        this(RelayPreferences.load(), Clock.systemDefaultZone());
    }

    public RelayContext(RelayPreferences.Settings settings, Clock clock) {
        this.dispatchExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "kdeconnect-dispatch");
            t.setDaemon(true);
            return t;
        });
        this.devices = new DeviceCache();
        this.burstWindow = new PairingBurstWindow(clock, settings.burstWindow());
        this.commands = new CommandDispatcher(dispatchExecutor, settings.pingMessage(), settings.ringMessage());
        this.sms = new SmsReconciler(commands, clock, settings.sendReconcileWindow());
        this.relay = new EventRelay(devices, new PairingNotifier(devices), burstWindow, sms);
        this.scheduler = new RefreshScheduler(settings.burstInterval(), settings.backstopInterval(), relay::enqueue);
    }

    public void start(CoreEventSource events, CoreChannel channel) {
        commands.attach(channel);
        relay.start(events);
        scheduler.start();
        logger.info("Relay context started");
    }

    public DeviceCache devices() {
        return devices;
    }

    public SmsReconciler sms() {
        return sms;
    }

    public CommandDispatcher commands() {
        return commands;
    }

    public EventRelay relay() {
        return relay;
    }

    public void addListener(RelayListener listener) {
        relay.addListener(listener);
    }

    public void removeListener(RelayListener listener) {
        relay.removeListener(listener);
    }

    public void acceptPairing(DeviceId id) {
        commands.pair(id);
        burstWindow.restart();
    }

    public void rejectPairing(DeviceId id) {
        commands.unpair(id);
    }

    @Override
    public void close() {
        scheduler.close();
        relay.stop();
        dispatchExecutor.shutdownNow();
        logger.info("Relay context closed");
    }
}
