package com.example.monitoring.schedule;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.monitoring.model.RiskLevel;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MonitoringSchedulerTest {

    private ScheduledThreadPoolExecutor timer;
    private MonitoringScheduler scheduler;

    @BeforeEach
    void setUp() {
        timer = new ScheduledThreadPoolExecutor(1);
        timer.setRemoveOnCancelPolicy(true);
        scheduler = new MonitoringScheduler(new CadencePolicy(30, 20), timer, Runnable::run, Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        timer.shutdownNow();
    }

    @Test
    void startSchedulesOneTimerPerTaskPlusTheSweep() {
        scheduler.start(noopTasks(), () -> {});

        assertTrue(scheduler.isRunning());
        assertEquals(4, scheduler.liveTimerCount());
        assertEquals(5, timer.getQueue().size());
    }

    @Test
    void bandChangesReplaceTimersWithoutLeakingAny() {
        scheduler.start(noopTasks(), () -> {});

        scheduler.updateBattery(25);
        scheduler.updateBattery(10);
        scheduler.updateRisk(RiskLevel.CRITICAL);
        scheduler.updateBattery(90);
        scheduler.updateBattery(95);

        assertEquals(4, scheduler.liveTimerCount());
        assertEquals(5, timer.getQueue().size());
        assertEquals(Duration.ofSeconds(10), scheduler.currentCadence().vitalSigns());
    }

    @Test
    void batteryDropUnderCriticalRiskUsesBatteryCadence() {
        scheduler.start(noopTasks(), () -> {});
        scheduler.updateRisk(RiskLevel.CRITICAL);

        scheduler.updateBattery(50);
        assertEquals(Duration.ofSeconds(10), scheduler.currentCadence().vitalSigns());

        scheduler.updateBattery(15);
        assertEquals(Duration.ofSeconds(120), scheduler.currentCadence().vitalSigns());
    }

    @Test
    void stopCancelsEverything() {
        scheduler.start(noopTasks(), () -> {});

        scheduler.stop();

        assertFalse(scheduler.isRunning());
        assertEquals(0, scheduler.liveTimerCount());
        assertTrue(timer.getQueue().isEmpty());
    }

    @Test
    void secondStartIsIgnored() {
        scheduler.start(noopTasks(), () -> {});
        scheduler.start(noopTasks(), () -> {});

        assertEquals(5, timer.getQueue().size());
    }

    @Test
    void cadenceTracksInputsWhileStopped() {
        scheduler.updateBattery(25);

        assertEquals(Duration.ofSeconds(60), scheduler.currentCadence().vitalSigns());
        assertEquals(0, scheduler.liveTimerCount());
        assertTrue(timer.getQueue().isEmpty());
    }

    private static Map<PeriodicTask, Runnable> noopTasks() {
        Map<PeriodicTask, Runnable> tasks = new EnumMap<>(PeriodicTask.class);
        for (PeriodicTask task : PeriodicTask.values()) {
            tasks.put(task, () -> {});
        }
        return tasks;
    }
}
