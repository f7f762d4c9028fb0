package com.eyelevel.invoicetransformer.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.LocalTime;

/**
 * Binds application properties under the "app.notification" prefix.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.notification")
public class NotificationConfig {

    private boolean enabled = false;
    private boolean sendDailySummary = true;

    /**
     * Local time of day (24-hour "HH:mm") after which the daily summary is emitted.
     */
    @Pattern(regexp = "([01]\\d|2[0-3]):[0-5]\\d")
    private String dailySummaryTime = "17:00";

    @Min(1000)
    private long summaryCheckIntervalMs = 60000;

    private boolean flushSummaryOnShutdown = true;

    public LocalTime dailySummaryLocalTime() {
        return LocalTime.parse(dailySummaryTime);
    }
}
