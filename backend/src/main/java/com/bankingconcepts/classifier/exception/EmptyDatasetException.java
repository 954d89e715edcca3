package com.bankingconcepts.classifier.exception;

/** Raised when a dataset has no columns or no rows, so there is nothing to analyse. */
public class EmptyDatasetException extends RuntimeException {

  public EmptyDatasetException(String message) {
    super(message);
  }
}
