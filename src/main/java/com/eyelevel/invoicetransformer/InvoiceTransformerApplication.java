package com.eyelevel.invoicetransformer;

import com.eyelevel.invoicetransformer.config.InvoiceProcessingConfig;
import com.eyelevel.invoicetransformer.config.NotificationConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Invoice Transformer Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link SpringBootApplication}: auto-configuration, component scanning and property support.</li>
 *     <li>{@link EnableConfigurationProperties}: binds the "app.processing" and "app.notification" properties
 *     to {@link InvoiceProcessingConfig} and {@link NotificationConfig}.</li>
 *     <li>{@link EnableScheduling}: activates the input folder poll cycle and the daily summary check.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(value = {InvoiceProcessingConfig.class, NotificationConfig.class})
public class InvoiceTransformerApplication {

    /**
     * Delegates to {@link SpringApplication} to launch the daemon and logs the watched folders once it is up.
     *
     * @param args Command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        log.info("🚀 Starting InvoiceTransformerApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(InvoiceTransformerApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "InvoiceTransformer"));
        log.info("  - Input folder:   {}", env.getProperty("app.processing.input-folder"));
        log.info("  - Output folder:  {}", env.getProperty("app.processing.output-folder"));
        log.info("  - Profile(s):     {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
