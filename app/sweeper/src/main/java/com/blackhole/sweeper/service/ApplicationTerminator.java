/*
 * Where: Sweeper service layer
 * What: Stops the process with a non-zero exit status
 * Why: A file that cannot be attributed to a channel leaves the sweeper in an unknown state
 */
package com.blackhole.sweeper.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ApplicationTerminator {

  static final int EXIT_CODE = 1;

  private static final Logger logger = LoggerFactory.getLogger(ApplicationTerminator.class);

  private final ConfigurableApplicationContext context;

  public void terminate(String reason, Throwable cause) {
    logger.error("sweeper terminating reason={}", reason, cause);
    final int exitCode = SpringApplication.exit(context, () -> EXIT_CODE);
    System.exit(exitCode);
  }
}
