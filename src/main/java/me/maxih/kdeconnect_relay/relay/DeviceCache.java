package me.maxih.kdeconnect_relay.relay;

import me.maxih.kdeconnect_relay.api.Device;
import me.maxih.kdeconnect_relay.api.DeviceId;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Last known state of every device currently connected to the Core.
 * <p>
 * Writes come from the relay loop only; any thread may read. Reads return copies, so a
 * caller that wants to change a single field reads the device, derives a new record and
 * upserts it.
 */
public class DeviceCache {
    private final Map<DeviceId, Device> devices = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public List<Device> getAll() {
        lock.readLock().lock();
        try {
            return List.copyOf(devices.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Device> get(DeviceId id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(devices.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return devices.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void upsert(Device device) {
        Objects.requireNonNull(device, "device");
        lock.writeLock().lock();
        try {
            devices.put(device.id(), device);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean remove(DeviceId id) {
        lock.writeLock().lock();
        try {
            return devices.remove(id) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
