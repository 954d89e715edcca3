package com.bankingconcepts.classifier.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "analysis")
public class ApplicationProperties {

  private String conceptRegistryResource = "/reference/banking-concepts.json";
  private int defaultMaxRows = 100000;

  private Parallel parallel = new Parallel();
  private DescriptionLookup descriptionLookup = new DescriptionLookup();

  @Data
  public static class Parallel {
    private boolean enabled = true;
  }

  @Data
  public static class DescriptionLookup {
    private boolean enabled = true;
    private String resource = "/reference/column-definitions.md";
    private long timeoutMs = 500;
    private Cache cache = new Cache();
  }

  @Data
  public static class Cache {
    private boolean enabled = true;
    private long maxSize = 1000;
    private long expireAfterWriteMinutes = 60;
  }
}
