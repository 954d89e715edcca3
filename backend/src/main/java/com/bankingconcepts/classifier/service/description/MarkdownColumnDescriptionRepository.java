package com.bankingconcepts.classifier.service.description;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Repository;

import com.bankingconcepts.classifier.config.ApplicationProperties;
import com.bankingconcepts.classifier.dto.description.ColumnDescription;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Column descriptions parsed from a markdown catalogue. Section headers look like {@code Customer
 * & Account Columns (1-20)}; entries look like {@code customer_id - Unique identifier ...}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class MarkdownColumnDescriptionRepository implements ColumnDescriptionLookup {

  static final String DEFAULT_SECTION = "General";

  private static final Pattern ENTRY =
      Pattern.compile("^([a-z_][a-z0-9_]*)\\s*-\\s*(.+)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern SECTION =
      Pattern.compile("^#*\\s*(.+?)\\s+Columns\\b.*$", Pattern.CASE_INSENSITIVE);

  private final ApplicationProperties applicationProperties;

  private Map<String, ColumnDescription> descriptions = Collections.emptyMap();

  @PostConstruct
  public void init() {
    String resource = applicationProperties.getDescriptionLookup().getResource();
    InputStream is = MarkdownColumnDescriptionRepository.class.getResourceAsStream(resource);
    if (is == null) {
      log.warn("Column description catalogue {} not found; descriptions disabled", resource);
      return;
    }
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
      descriptions = Collections.unmodifiableMap(parse(reader));
      log.info("Loaded {} column descriptions from {}", descriptions.size(), resource);
    } catch (IOException e) {
      log.warn("Failed to read column description catalogue {}: {}", resource, e.getMessage());
    }
  }

  Map<String, ColumnDescription> parse(BufferedReader reader) throws IOException {
    Map<String, ColumnDescription> parsed = new LinkedHashMap<>();
    String section = DEFAULT_SECTION;
    String line;
    while ((line = reader.readLine()) != null) {
      line = line.trim();
      if (line.isEmpty()) {
        continue;
      }
      if (line.contains("Columns") && (line.contains("(") || line.contains("&"))) {
        Matcher header = SECTION.matcher(line);
        String name = header.matches() ? header.group(1) : line.split("Columns")[0];
        name = name.replace("#", "").replace("&", "and").trim();
        section = name.isEmpty() ? DEFAULT_SECTION : name;
        continue;
      }
      Matcher entry = ENTRY.matcher(line.replaceFirst("^[-*]\\s+", ""));
      if (entry.matches()) {
        String columnName = entry.group(1).toLowerCase(Locale.ROOT);
        parsed.put(
            columnName,
            ColumnDescription.builder()
                .columnName(columnName)
                .description(entry.group(2).trim())
                .section(section)
                .build());
      }
    }
    return parsed;
  }

  @Override
  public Optional<ColumnDescription> lookupDescription(String columnName) {
    if (columnName == null || columnName.isBlank()) {
      return Optional.empty();
    }
    String normalized =
        columnName.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');

    ColumnDescription direct = descriptions.get(normalized);
    if (direct != null) {
      return Optional.of(direct);
    }
    for (Map.Entry<String, ColumnDescription> entry : descriptions.entrySet()) {
      if (normalized.contains(entry.getKey()) || entry.getKey().contains(normalized)) {
        return Optional.of(entry.getValue());
      }
    }
    String base = stripSuffixes(normalized);
    for (Map.Entry<String, ColumnDescription> entry : descriptions.entrySet()) {
      if (base.equals(stripSuffixes(entry.getKey()))) {
        return Optional.of(entry.getValue());
      }
    }
    return Optional.empty();
  }

  @Override
  public int size() {
    return descriptions.size();
  }

  private static String stripSuffixes(String name) {
    return name.replace("_id", "").replace("_number", "").replace("_code", "");
  }
}
