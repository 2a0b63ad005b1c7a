package com.questrail.instrument.device;

import com.questrail.instrument.api.Device;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live devices by name.
 *
 * <p>A device registers itself when it is created and unregisters when it is
 * killed. {@link #killAll()} is the shutdown path of the whole engine.</p>
 */
public final class DeviceRegistry {

    private final Map<String, Device> devices = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if a device with the same name is live
     */
    public void register(Device device) {
        Objects.requireNonNull(device, "device");
        Device previous = devices.putIfAbsent(device.name(), device);
        if (previous != null && previous != device) {
            throw new IllegalStateException("Device already registered: " + device.name());
        }
    }

    public Optional<Device> get(String name) {
        return Optional.ofNullable(devices.get(name));
    }

    /** Snapshot of the live devices. */
    public Collection<Device> all() {
        return Collections.unmodifiableList(new ArrayList<>(devices.values()));
    }

    /**
     * Removes {@code device} if it is the one registered under its name.
     */
    public boolean unregister(Device device) {
        Objects.requireNonNull(device, "device");
        return devices.remove(device.name(), device);
    }

    /**
     * Kills every live device. A device whose {@code kill} throws does not
     * stop the others; the first failure is rethrown at the end with the rest
     * suppressed.
     */
    public void killAll() {
        List<Device> snapshot = new ArrayList<>(devices.values());
        RuntimeException failure = null;
        for (Device device : snapshot) {
            try {
                device.kill();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
            devices.remove(device.name(), device);
        }
        if (failure != null) {
            throw failure;
        }
    }

    public int size() {
        return devices.size();
    }
}
