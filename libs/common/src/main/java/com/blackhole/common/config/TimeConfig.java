/*
 * Where: Common configuration
 * What: Exposes the UTC Clock used for due-time arithmetic
 * Why: Lets services and tests share one injectable time source
 */
package com.blackhole.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
