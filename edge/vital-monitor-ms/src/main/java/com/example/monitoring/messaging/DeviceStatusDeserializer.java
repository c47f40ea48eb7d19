package com.example.monitoring.messaging;

import io.quarkus.kafka.client.serialization.ObjectMapperDeserializer;

public class DeviceStatusDeserializer extends ObjectMapperDeserializer<DeviceStatusEvent> {

    public DeviceStatusDeserializer() {
        super(DeviceStatusEvent.class);
    }
}
