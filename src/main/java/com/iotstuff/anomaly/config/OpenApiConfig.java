package com.iotstuff.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI telemetryAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Telemetry Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Streaming anomaly detection for per-device CPU usage telemetry.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Receive a reading via `POST /readings`\n" +
                                "2. Load the device's rolling window (last 100 readings) and EWMA state\n" +
                                "3. Derive thresholds from the pinned baseline, or adaptively from the window\n" +
                                "4. Score the reading with five detectors\n" +
                                "5. Report an anomaly when at least two detectors agree: " +
                                "**MEDIUM**, **HIGH** or **CRITICAL**\n\n" +
                                "**Detectors:**\n" +
                                "- `z_score` - distance from the window mean in standard deviations\n" +
                                "- `ewma_score` - deviation from the exponentially weighted mean\n" +
                                "- `rate_of_change` - jump from the previous reading\n" +
                                "- `mad` - modified z-score over the median absolute deviation\n" +
                                "- `hampel` - Hampel filter over the 14 preceding readings\n\n" +
                                "Devices return no anomalies until 50 readings have been seen.")
                        .contact(new Contact().name("IoT Platform Team")));
    }
}
