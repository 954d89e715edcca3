package com.bankingconcepts.classifier.service.concept;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.bankingconcepts.classifier.config.ApplicationProperties;
import com.bankingconcepts.classifier.dto.concept.ConceptDefinition;
import com.bankingconcepts.classifier.dto.concept.ConceptMatch;
import com.bankingconcepts.classifier.dto.concept.ConceptRegistryDocument;
import com.bankingconcepts.classifier.exception.ConceptRegistryException;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only catalogue of banking concept definitions. The registry is loaded once from the
 * versioned JSON artifact at startup and never mutated afterwards, so it can be shared freely
 * between concurrent analyses.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConceptRegistryService {

  private final ObjectMapper objectMapper;
  private final ApplicationProperties applicationProperties;

  private Map<String, ConceptDefinition> definitions = Collections.emptyMap();
  private List<ConceptDefinition> orderedDefinitions = List.of();
  private String version;

  @PostConstruct
  public void init() {
    String resource = applicationProperties.getConceptRegistryResource();
    InputStream is = ConceptRegistryService.class.getResourceAsStream(resource);
    if (is == null) {
      throw new ConceptRegistryException("Concept registry resource not found: " + resource);
    }
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
      ConceptRegistryDocument document =
          objectMapper.readValue(reader, ConceptRegistryDocument.class);
      load(document);
      log.info(
          "Loaded {} banking concepts (registry version {}) from {}",
          definitions.size(),
          version,
          resource);
    } catch (IOException e) {
      log.error("Failed to load concept registry from {}", resource, e);
      throw new ConceptRegistryException("Failed to initialize concept registry", e);
    }
  }

  void load(ConceptRegistryDocument document) {
    if (document == null || document.getConcepts() == null || document.getConcepts().isEmpty()) {
      throw new ConceptRegistryException("Concept registry contains no concepts");
    }
    Map<String, ConceptDefinition> loaded = new LinkedHashMap<>();
    for (ConceptDefinition definition : document.getConcepts()) {
      validate(definition);
      if (loaded.putIfAbsent(definition.getConceptKey(), definition) != null) {
        throw new ConceptRegistryException(
            "Duplicate concept key in registry: " + definition.getConceptKey());
      }
    }
    this.definitions = Collections.unmodifiableMap(loaded);
    this.orderedDefinitions = List.copyOf(loaded.values());
    this.version = document.getVersion() != null ? document.getVersion() : "unversioned";
  }

  private void validate(ConceptDefinition definition) {
    String key = definition.getConceptKey();
    if (key == null || key.isBlank()) {
      throw new ConceptRegistryException("Concept definition without concept_key");
    }
    if (ConceptMatch.UNKNOWN_KEY.equals(key)) {
      throw new ConceptRegistryException("'unknown' is reserved and cannot be a concept key");
    }
    if (definition.getDomain() == null) {
      throw new ConceptRegistryException("Concept '" + key + "' has no domain");
    }
    if (definition.getNamePatterns() == null || definition.getNamePatterns().isEmpty()) {
      throw new ConceptRegistryException("Concept '" + key + "' has no name patterns");
    }
    if (definition.getDataPatterns() == null || definition.getBusinessRules() == null) {
      throw new ConceptRegistryException(
          "Concept '" + key + "' is missing data patterns or business rules");
    }
  }

  /** Definitions in registry order; ties during matching are broken by this order. */
  public List<ConceptDefinition> getDefinitions() {
    return orderedDefinitions;
  }

  public Optional<ConceptDefinition> findDefinition(String conceptKey) {
    if (conceptKey == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(definitions.get(conceptKey));
  }

  public String getVersion() {
    return version;
  }

  public int size() {
    return definitions.size();
  }
}
