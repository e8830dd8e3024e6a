package com.flamingo.ai.olivia.service.rag.retrieval;

import com.fasterxml.jackson.annotation.JsonValue;

/** How much retrieval effort a query deserves. */
public enum QueryComplexity {
  SIMPLE("simple"),
  MODERATE("moderate"),
  COMPLEX("complex");

  private final String value;

  QueryComplexity(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
