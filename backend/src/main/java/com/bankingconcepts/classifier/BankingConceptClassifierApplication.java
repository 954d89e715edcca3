package com.bankingconcepts.classifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BankingConceptClassifierApplication {

  public static void main(String[] args) {
    SpringApplication.run(BankingConceptClassifierApplication.class, args);
  }
}
