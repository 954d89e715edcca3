package com.bankingconcepts.classifier.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("MdcTaskDecorator Tests")
class MdcTaskDecoratorTest {

  private final MdcTaskDecorator decorator = new MdcTaskDecorator();
  private ExecutorService worker;

  @BeforeEach
  void setUp() {
    worker = Executors.newSingleThreadExecutor();
  }

  @AfterEach
  void tearDown() {
    MDC.clear();
    worker.shutdownNow();
  }

  @Test
  @DisplayName("Should run the task with the submitting thread's MDC")
  void shouldPropagateSubmitterContext() throws Exception {
    MDC.put("correlationId", "req-42");
    MDC.put("datasetName", "core_banking_sample");
    AtomicReference<String> seenCorrelation = new AtomicReference<>();
    AtomicReference<String> seenDataset = new AtomicReference<>();

    Runnable task =
        decorator.decorate(
            () -> {
              seenCorrelation.set(MDC.get("correlationId"));
              seenDataset.set(MDC.get("datasetName"));
            });
    worker.submit(task).get(5, TimeUnit.SECONDS);

    assertThat(seenCorrelation.get()).isEqualTo("req-42");
    assertThat(seenDataset.get()).isEqualTo("core_banking_sample");
  }

  @Test
  @DisplayName("Should not leak the submitter's MDC into later tasks on the same thread")
  void shouldRestoreWorkerContext() throws Exception {
    MDC.put("datasetName", "core_banking_sample");
    worker.submit(decorator.decorate(() -> {})).get(5, TimeUnit.SECONDS);
    MDC.clear();

    AtomicReference<String> leaked = new AtomicReference<>("unset");
    worker.submit(() -> leaked.set(MDC.get("datasetName"))).get(5, TimeUnit.SECONDS);

    assertThat(leaked.get()).isNull();
  }

  @Test
  @DisplayName("Should leave the MDC empty when the submitter had none")
  void shouldHandleEmptySubmitterContext() throws Exception {
    AtomicReference<String> seen = new AtomicReference<>("unset");

    worker.submit(decorator.decorate(() -> seen.set(MDC.get("correlationId"))))
        .get(5, TimeUnit.SECONDS);

    assertThat(seen.get()).isNull();
  }
}
