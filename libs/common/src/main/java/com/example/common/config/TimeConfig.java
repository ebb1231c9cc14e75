/*
 * Where: common configuration
 * What: exposes the UTC Clock as an injectable bean
 * Why: every time read goes through one Clock so tests can pin or replace it
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
