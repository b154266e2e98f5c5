package com.mobifone.updatecenter.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "batch-install.reconciler")
@Data
public class ReconcilerProperties {
    /**
     * Hard ceiling on one reconciliation run; the batch is forced to FAILED past it.
     */
    private Duration maxRunTime = Duration.ofHours(2);

    /**
     * Poll interval while the installer still reports the handle as starting.
     */
    private Duration pollIntervalStarting = Duration.ofSeconds(3);

    private Duration pollIntervalRunning = Duration.ofSeconds(10);

    /**
     * Wait between attempts when the progress handle cannot be read.
     */
    private Duration handleLookupInterval = Duration.ofSeconds(3);

    private int handleLookupAttempts = 20;

    // reconciler executor sizing
    private int corePoolSize = 4;
    private int maxPoolSize = 16;
}
