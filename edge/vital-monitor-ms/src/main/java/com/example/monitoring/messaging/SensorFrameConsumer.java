package com.example.monitoring.messaging;

import com.example.monitoring.pipeline.MonitoringPipeline;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.jboss.logging.Logger;

/** Entry point for sealed frames from the wearable link. */
@ApplicationScoped
public class SensorFrameConsumer {

    private static final Logger LOG = Logger.getLogger(SensorFrameConsumer.class);

    private final MonitoringPipeline pipeline;

    public SensorFrameConsumer(MonitoringPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Incoming("sensor-frames")
    public void onFrame(byte[] frame) {
        if (frame == null || frame.length == 0) {
            LOG.warn("Ignoring empty sensor frame");
            return;
        }
        pipeline.submit(frame);
    }
}
