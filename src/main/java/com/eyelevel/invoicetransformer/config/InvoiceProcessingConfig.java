package com.eyelevel.invoicetransformer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Binds application properties under the "app.processing" prefix to a strongly-typed
 * configuration object. Holds the folder layout and the file lifecycle tuning knobs.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.processing")
public class InvoiceProcessingConfig {

    @NotBlank
    private String inputFolder;
    @NotBlank
    private String outputFolder;
    @NotBlank
    private String archiveFolder;
    @NotBlank
    private String errorFolder;
    private String logFolder;

    /**
     * When true the source file is moved to the archive folder after a successful transform,
     * otherwise it is deleted.
     */
    private boolean archiveProcessedFiles = true;

    @Min(1)
    private int pollingIntervalSeconds = 5;

    @NotBlank
    private String fileExtension = "xml";

    @Valid
    private Watch watch = new Watch();
    @Valid
    private RetryConfig lockRetry = new RetryConfig();
    private StartupScan startupScan = new StartupScan();

    @Data
    public static class RetryConfig {
        @Min(1)
        private int attempts = 5;
        @Min(0)
        private long delayMs = 1000;
    }

    @Data
    public static class Watch {
        private boolean enabled = true;
        @Min(0)
        private long debounceMs = 500;
    }

    @Data
    public static class StartupScan {
        private boolean enabled = true;
    }
}
