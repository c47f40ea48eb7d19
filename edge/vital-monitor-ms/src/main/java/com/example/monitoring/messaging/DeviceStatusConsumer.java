package com.example.monitoring.messaging;

import com.example.monitoring.schedule.MonitoringScheduler;
import com.example.monitoring.sync.SyncService;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.jboss.logging.Logger;

@ApplicationScoped
public class DeviceStatusConsumer {

    private static final Logger LOG = Logger.getLogger(DeviceStatusConsumer.class);

    private final MonitoringScheduler scheduler;
    private final SyncService syncService;

    public DeviceStatusConsumer(MonitoringScheduler scheduler, SyncService syncService) {
        this.scheduler = scheduler;
        this.syncService = syncService;
    }

    @Incoming("device-status")
    public void onStatus(DeviceStatusEvent event) {
        if (event == null) {
            LOG.warn("Ignoring unreadable device status event");
            return;
        }
        LOG.debugf("Device status: %s", event);
        if (event.batteryPct != null) {
            if (event.batteryPct < 0 || event.batteryPct > 100) {
                LOG.warnf("Ignoring out-of-range battery level %.1f", event.batteryPct);
            } else {
                scheduler.updateBattery(event.batteryPct);
            }
        }
        if (event.online != null) {
            syncService.connectivityChanged(event.online);
        }
    }
}
