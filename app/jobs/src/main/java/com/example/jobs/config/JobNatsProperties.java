/*
 * Where: jobs configuration binding
 * What: subject used to wake other instances that share the jobs table
 * Why: keep the subject name per environment
 */
package com.example.jobs.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "jobs.nats")
@Validated
public record JobNatsProperties(@NotBlank String triggerSubject) {}
