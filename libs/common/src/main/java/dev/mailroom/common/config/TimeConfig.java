/*
 * Where: shared configuration
 * What: exposes the system UTC clock as an injectable bean
 * Why: lets services read time through one Clock that tests can replace with a fixed one
 */
package dev.mailroom.common.config;

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
