package com.finrag;

import com.finrag.logging.LoggingService;
import org.slf4j.Logger;

public class FinRagApp {
  private static final Logger log = LoggingService.getLogger(FinRagApp.class);

  public static void main(String[] args) {
    try {
      FinRag app = new FinRag(args);
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
