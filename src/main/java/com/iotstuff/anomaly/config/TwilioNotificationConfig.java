package com.iotstuff.anomaly.config;

import com.iotstuff.anomaly.model.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Operator alerts for anomaly events. Only events at or above {@code minSeverity} are sent.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private boolean enabled = false;
    private String channel = "sms";  // "sms" or "whatsapp"
    private Severity minSeverity = Severity.MEDIUM;

    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String toNumber;

    // Appended to each alert when set
    private String dashboardUrl;
}
