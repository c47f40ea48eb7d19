package com.example.monitoring.messaging;

/** Battery and link state reported by the host device. Either field may be absent. */
public class DeviceStatusEvent {

    public Double batteryPct;
    public Boolean online;

    @Override
    public String toString() {
        return "DeviceStatusEvent{batteryPct=%s, online=%s}".formatted(batteryPct, online);
    }
}
