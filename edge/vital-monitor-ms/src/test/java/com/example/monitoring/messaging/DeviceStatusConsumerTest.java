package com.example.monitoring.messaging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.example.monitoring.Await;
import com.example.monitoring.schedule.MonitoringScheduler;
import com.example.monitoring.sync.SyncService;
import io.quarkus.test.junit.QuarkusTest;
import io.smallrye.reactive.messaging.memory.InMemoryConnector;
import io.smallrye.reactive.messaging.memory.InMemorySource;
import jakarta.inject.Inject;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.eclipse.microprofile.reactive.messaging.spi.Connector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@QuarkusTest
class DeviceStatusConsumerTest {

    @Inject
    MonitoringScheduler scheduler;

    @Inject
    SyncService syncService;

    @Inject
    @Connector("smallrye-in-memory")
    InMemoryConnector connector;

    private InMemorySource<DeviceStatusEvent> status;

    @BeforeEach
    void setUp() {
        status = connector.source("device-status");
    }

    @AfterEach
    void restore() {
        scheduler.updateBattery(100);
        syncService.connectivityChanged(true);
    }

    @Test
    void batteryReportMovesTheScheduler() {
        status.send(event(25.0, null));

        Await.until("battery applied", Duration.ofSeconds(5), () -> scheduler.batteryPct() == 25.0);
        assertEquals(Duration.ofSeconds(60), scheduler.currentCadence().vitalSigns());
    }

    @Test
    void outOfRangeBatteryIsIgnored() {
        status.send(event(250.0, null));
        status.send(event(40.0, null));

        Await.until("valid battery applied", Duration.ofSeconds(5), () -> scheduler.batteryPct() == 40.0);
    }

    @Test
    void linkStateReachesSync() {
        status.send(event(null, false));

        Await.until("offline", Duration.ofSeconds(5), () -> !syncService.isOnline());
    }

    @Test
    void deserializerReadsPartialEvents() {
        try (DeviceStatusDeserializer deserializer = new DeviceStatusDeserializer()) {
            DeviceStatusEvent event = deserializer.deserialize(
                "device-status",
                "{\"batteryPct\":42.5}".getBytes(StandardCharsets.UTF_8)
            );

            assertEquals(42.5, event.batteryPct);
            assertNull(event.online);
            assertNull(deserializer.deserialize("device-status", null));
        }
    }

    private static DeviceStatusEvent event(Double batteryPct, Boolean online) {
        DeviceStatusEvent e = new DeviceStatusEvent();
        e.batteryPct = batteryPct;
        e.online = online;
        return e;
    }
}
