package com.bankingconcepts.classifier.exception;

/** The concept registry artifact could not be loaded or failed validation. */
public class ConceptRegistryException extends RuntimeException {

  public ConceptRegistryException(String message) {
    super(message);
  }

  public ConceptRegistryException(String message, Throwable cause) {
    super(message, cause);
  }
}
