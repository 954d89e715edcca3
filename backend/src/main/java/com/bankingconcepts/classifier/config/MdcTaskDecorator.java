package com.bankingconcepts.classifier.config;

import java.util.Map;

import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

/**
 * Carries the submitting thread's MDC (correlation id, dataset name) into pool threads and
 * restores the worker's own context afterwards.
 */
public class MdcTaskDecorator implements TaskDecorator {

  @Override
  public Runnable decorate(Runnable runnable) {
    Map<String, String> submitterContext = MDC.getCopyOfContextMap();
    return () -> {
      Map<String, String> workerContext = MDC.getCopyOfContextMap();
      applyContext(submitterContext);
      try {
        runnable.run();
      } finally {
        applyContext(workerContext);
      }
    };
  }

  private static void applyContext(Map<String, String> context) {
    if (context == null) {
      MDC.clear();
    } else {
      MDC.setContextMap(context);
    }
  }
}
