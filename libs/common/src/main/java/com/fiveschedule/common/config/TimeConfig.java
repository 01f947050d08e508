/*
 * Where: shared configuration
 * What: exposes a UTC Clock bean
 * Why: every component reads "now" from the same injectable source
 */
package com.fiveschedule.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
