package com.example.eventrelay.config;

import com.example.eventrelay.websocket.ConnectionRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public MeterBinder realtimeConnectionsGauge(ConnectionRegistry registry) {
        return meterRegistry -> Gauge.builder("realtime.connections", registry, ConnectionRegistry::connectionCount)
                .description("Open duplex connections in the registry")
                .register(meterRegistry);
    }
}
