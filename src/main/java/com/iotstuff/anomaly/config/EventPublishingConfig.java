package com.iotstuff.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "events")
public class EventPublishingConfig {
    private boolean enabled = true;
    private String topic = "iotstuff.anomaly-events";
    private String source = "iotstuff.anomaly-detection";
    private String detailType = "AnomalyDetected";
    private String anomalyType = "cpu_usage";
    private String deviceLocation = "local";
    private String deviceName = "laptop01";
}
