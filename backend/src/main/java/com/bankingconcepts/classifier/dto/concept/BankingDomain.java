package com.bankingconcepts.classifier.dto.concept;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Banking sub-area a concept belongs to, with the workflow role used when a concept has none. */
public enum BankingDomain {
  CUSTOMER(
      "Customer",
      "Describes the customer. Used during onboarding, KYC verification and customer"
          + " communication."),
  ACCOUNT(
      "Account",
      "Describes the account. Drives account servicing, interest and fee calculation and"
          + " statement generation."),
  LOAN(
      "Loan",
      "Describes the loan. Used across sanction, disbursement, EMI collection and loan closure."),
  TRANSACTION(
      "Transaction",
      "Describes the transaction. Used for posting, balance updates, reconciliation and audit."),
  GENERAL("General", "Role in the business workflow requires domain expert review.");

  private final String displayName;
  private final String genericWorkflowRole;

  BankingDomain(String displayName, String genericWorkflowRole) {
    this.displayName = displayName;
    this.genericWorkflowRole = genericWorkflowRole;
  }

  @JsonValue
  public String getDisplayName() {
    return displayName;
  }

  public String getGenericWorkflowRole() {
    return genericWorkflowRole;
  }

  @JsonCreator
  public static BankingDomain fromDisplayName(String value) {
    if (value == null) {
      return null;
    }
    for (BankingDomain domain : values()) {
      if (domain.displayName.equalsIgnoreCase(value.trim())) {
        return domain;
      }
    }
    throw new IllegalArgumentException("Unknown banking domain: " + value);
  }
}
