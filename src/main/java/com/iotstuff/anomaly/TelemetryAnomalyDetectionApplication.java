package com.iotstuff.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Telemetry anomaly detection service. Readings arrive over REST or, when enabled, from the
 * telemetry Kafka topic; anomalies go to the event topic and, above the severity floor, to Twilio.
 */
@SpringBootApplication
@EnableAsync
public class TelemetryAnomalyDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(TelemetryAnomalyDetectionApplication.class, args);
    }
}
