package com.bankingconcepts.classifier.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.bankingconcepts.classifier.dto.concept.ConceptDefinition;
import com.bankingconcepts.classifier.exception.ResourceNotFoundException;
import com.bankingconcepts.classifier.service.concept.ConceptRegistryService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/concepts")
@RequiredArgsConstructor
@Tag(name = "Concept Registry", description = "Read-only view of the banking concept registry")
public class ConceptRegistryController {

  private final ConceptRegistryService conceptRegistry;

  @GetMapping
  @Operation(summary = "List concepts", description = "Returns every registered banking concept")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Registry contents")})
  public ResponseEntity<Map<String, Object>> listConcepts() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("version", conceptRegistry.getVersion());
    body.put("concepts", conceptRegistry.getDefinitions());
    return ResponseEntity.ok(body);
  }

  @GetMapping("/{conceptKey}")
  @Operation(summary = "Get concept", description = "Returns one banking concept definition")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Concept found"),
        @ApiResponse(responseCode = "404", description = "Concept not found")
      })
  public ResponseEntity<ConceptDefinition> getConcept(
      @Parameter(description = "Concept key, e.g. account_number") @PathVariable
          String conceptKey) {
    log.debug("Looking up concept '{}'", conceptKey);
    return conceptRegistry
        .findDefinition(conceptKey)
        .map(ResponseEntity::ok)
        .orElseThrow(() -> new ResourceNotFoundException("Concept not found: " + conceptKey));
  }
}
