package com.bankingconcepts.classifier.service.description;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.bankingconcepts.classifier.config.ApplicationProperties;
import com.bankingconcepts.classifier.dto.description.ColumnDescription;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * Guards the description catalogue: lookups are cached process-wide and bounded by a timeout. A
 * missing, slow or failing lookup always degrades to "no description".
 */
@Slf4j
@Service
public class ColumnDescriptionService {

  private final ColumnDescriptionLookup lookup;
  private final ApplicationProperties applicationProperties;
  private final Executor lookupExecutor;

  private Cache<String, Optional<ColumnDescription>> descriptionCache;

  public ColumnDescriptionService(
      ColumnDescriptionLookup lookup,
      ApplicationProperties applicationProperties,
      @Qualifier("descriptionLookupExecutor") Executor lookupExecutor) {
    this.lookup = lookup;
    this.applicationProperties = applicationProperties;
    this.lookupExecutor = lookupExecutor;
  }

  @PostConstruct
  public void init() {
    ApplicationProperties.Cache cache = applicationProperties.getDescriptionLookup().getCache();
    if (cache.isEnabled()) {
      descriptionCache =
          CacheBuilder.newBuilder()
              .maximumSize(cache.getMaxSize())
              .expireAfterWrite(cache.getExpireAfterWriteMinutes(), TimeUnit.MINUTES)
              .build();
    }
  }

  /**
   * Finds the documented description of a column.
   *
   * @param columnName the column name
   * @return the description, or empty when none is available in time
   */
  public Optional<ColumnDescription> describe(String columnName) {
    if (!applicationProperties.getDescriptionLookup().isEnabled() || columnName == null) {
      return Optional.empty();
    }
    if (descriptionCache != null) {
      Optional<ColumnDescription> cached = descriptionCache.getIfPresent(columnName);
      if (cached != null) {
        return cached;
      }
    }

    Optional<ColumnDescription> description;
    try {
      description = lookupWithTimeout(columnName);
    } catch (TimeoutException e) {
      log.warn("Description lookup for column '{}' timed out", columnName);
      return Optional.empty();
    } catch (ExecutionException e) {
      log.warn(
          "Description lookup for column '{}' failed: {}",
          columnName,
          e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
      return Optional.empty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Description lookup for column '{}' interrupted", columnName);
      return Optional.empty();
    } catch (RejectedExecutionException e) {
      log.warn("Description lookup pool saturated; column '{}' left undescribed", columnName);
      return Optional.empty();
    }

    if (descriptionCache != null) {
      descriptionCache.put(columnName, description);
    }
    return description;
  }

  private Optional<ColumnDescription> lookupWithTimeout(String columnName)
      throws InterruptedException, ExecutionException, TimeoutException {
    long timeoutMs = applicationProperties.getDescriptionLookup().getTimeoutMs();
    Optional<ColumnDescription> result =
        CompletableFuture.supplyAsync(() -> lookup.lookupDescription(columnName), lookupExecutor)
            .get(timeoutMs, TimeUnit.MILLISECONDS);
    return result != null ? result : Optional.empty();
  }
}
