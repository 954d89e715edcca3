package com.bankingconcepts.classifier.dto.concept;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** On-disk shape of the versioned concept registry artifact. */
@Value
@Builder
@Jacksonized
public class ConceptRegistryDocument {

  @JsonProperty("version")
  String version;

  @JsonProperty("concepts")
  List<ConceptDefinition> concepts;
}
