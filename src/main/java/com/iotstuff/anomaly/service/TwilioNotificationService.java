package com.iotstuff.anomaly.service;

import com.iotstuff.anomaly.config.MetricsConfig;
import com.iotstuff.anomaly.config.TwilioNotificationConfig;
import com.iotstuff.anomaly.model.AnomalyEvent;
import com.iotstuff.anomaly.model.AnomalyReport;
import com.iotstuff.anomaly.model.DetectorType;
import com.iotstuff.anomaly.model.Severity;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.stream.Collectors;

@Service
public class TwilioNotificationService {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);
    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification service initialized. Channel: {}, min severity: {}",
                    config.getChannel(), config.getMinSeverity());
        } else {
            log.info("Twilio notification service is DISABLED.");
        }
    }

    public boolean shouldNotify(Severity severity) {
        return config.isEnabled() && severity != null && severity.isAtLeast(config.getMinSeverity());
    }

    @Async
    @Observed(name = "notification.send", contextualName = "send-notification")
    public void notifyIfSevere(AnomalyEvent event) {
        Severity severity = event.getReport().getSeverity();
        if (!shouldNotify(severity)) {
            log.debug("Skipping notification for device={} severity={} (min {})",
                    event.getDeviceId(), severity, config.getMinSeverity());
            return;
        }

        try {
            String body = buildMessageBody(event);
            String from = resolveNumber(config.getFromNumber());
            String to = resolveNumber(config.getToNumber());

            Message message = Message.creator(
                    new PhoneNumber(to),
                    new PhoneNumber(from),
                    body
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Twilio notification sent for device={}, severity={}, sid={}",
                    event.getDeviceId(), severity, message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send Twilio notification for device={}: {}",
                    event.getDeviceId(), e.getMessage(), e);
        }
    }

    String buildMessageBody(AnomalyEvent event) {
        AnomalyReport report = event.getReport();
        String methods = report.getMethodsTriggered().stream()
                .map(DetectorType::getKey)
                .collect(Collectors.joining(", "));

        StringBuilder body = new StringBuilder();
        body.append(String.format("[ANOMALY ALERT] %s%n", report.getSeverity()));
        body.append(String.format("Device: %s (%s @ %s)%n",
                event.getDeviceId(), event.getDeviceName(), event.getDeviceLocation()));
        body.append(String.format("Time: %s UTC%n", TIME_FORMAT.format(Instant.ofEpochMilli(event.getTimestamp()))));
        body.append(String.format("CPU Usage: %.2f%%%n", report.getValue()));
        body.append(String.format("Z-Score: %.2f | EWMA: %.2f | Rate of change: %.2f%n",
                report.getZScore(), report.getEwmaScore(), report.getRateOfChange()));
        body.append(String.format("Hampel filter: %s%n", report.isHampelTriggered() ? "triggered" : "not triggered"));
        body.append(String.format("Methods: %s (%d)%n", methods, report.getMethodCount()));
        body.append(String.format("Window mean/std: %.2f / %.2f%n", report.getMean(), report.getStd()));
        body.append(recommendation(report.getSeverity()));

        if (config.getDashboardUrl() != null && !config.getDashboardUrl().isBlank()) {
            body.append(String.format("%nDashboard: %s", config.getDashboardUrl()));
        }
        return body.toString();
    }

    private static String recommendation(Severity severity) {
        switch (severity) {
            case CRITICAL:
                return "Action: immediate investigation, multiple detectors triggered";
            case HIGH:
                return "Action: monitor device closely, consider preventive maintenance";
            default:
                return "Action: monitor trends for patterns";
        }
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
