package com.bankingconcepts.classifier.service.description;

import java.util.Optional;

import com.bankingconcepts.classifier.dto.description.ColumnDescription;

/** Read-only source of human-authored column descriptions. */
public interface ColumnDescriptionLookup {

  /**
   * Looks up the description of a column by full or partial name.
   *
   * @param columnName the column name as found in the dataset
   * @return the description, or empty when the catalogue has none
   */
  Optional<ColumnDescription> lookupDescription(String columnName);

  /** Number of documented columns. */
  int size();
}
