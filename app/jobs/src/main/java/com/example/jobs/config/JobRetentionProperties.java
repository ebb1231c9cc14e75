/*
 * Where: jobs configuration binding
 * What: retention window and cleanup cadence for terminally failed jobs
 * Why: failed rows are kept for inspection but must not grow without bound
 */
package com.example.jobs.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "jobs.retention")
public record JobRetentionProperties(boolean enabled, int retentionDays, Duration cleanupInterval) {}
