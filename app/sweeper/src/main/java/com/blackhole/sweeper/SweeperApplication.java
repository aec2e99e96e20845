/*
 * Where: Sweeper application entry point
 * What: Boots Spring, binds configuration records and enables scheduled workers
 * Why: Reconciliation runs on @Scheduled and every setting lives in @ConfigurationProperties
 */
package com.blackhole.sweeper;

import com.blackhole.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class SweeperApplication {

  public static void main(String[] args) {
    SpringApplication.run(SweeperApplication.class, args);
  }
}
