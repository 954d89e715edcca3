package com.bankingconcepts.classifier.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;

@Configuration
public class OpenApiConfig {

  static final String ANALYSIS_TAG = "Dataset Analysis";
  static final String REGISTRY_TAG = "Concept Registry";

  @Value("${springdoc.info.title:Banking Concept Classifier API}")
  private String title;

  @Value("${springdoc.info.version:1.0.0}")
  private String version;

  @Value(
      "${springdoc.info.description:Profiles dataset columns and classifies them into banking"
          + " concepts.}")
  private String description;

  @Value("${server.port:8081}")
  private String serverPort;

  @Bean
  public OpenAPI bankingConceptOpenAPI() {
    return new OpenAPI()
        .info(new Info().title(title).version(version).description(description))
        .tags(
            List.of(
                new Tag()
                    .name(ANALYSIS_TAG)
                    .description("Banking concept classification of dataset columns"),
                new Tag()
                    .name(REGISTRY_TAG)
                    .description("Read-only view of the banking concept registry")))
        .servers(
            List.of(
                new Server()
                    .url("http://localhost:" + serverPort)
                    .description("Local development server")));
  }
}
