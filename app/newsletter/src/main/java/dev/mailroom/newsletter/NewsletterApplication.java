/*
 * Where: newsletter application entry point
 * What: boots Spring and scans configuration properties
 * Why: enables configuration records and the scheduled reaper in one place
 */
package dev.mailroom.newsletter;

import dev.mailroom.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class NewsletterApplication {

  public static void main(String[] args) {
    SpringApplication.run(NewsletterApplication.class, args);
  }
}
