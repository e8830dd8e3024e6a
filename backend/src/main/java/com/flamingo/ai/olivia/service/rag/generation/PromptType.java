package com.flamingo.ai.olivia.service.rag.generation;

/** Template variants for context-grounded answers. */
public enum PromptType {
  DEFAULT(PromptTemplates.DEFAULT_RAG_PROMPT),
  DETAILED(PromptTemplates.DETAILED_RAG_PROMPT),
  CONCISE(PromptTemplates.CONCISE_RAG_PROMPT),
  ANALYTICAL(PromptTemplates.ANALYTICAL_RAG_PROMPT);

  private final String template;

  PromptType(String template) {
    this.template = template;
  }

  public String getTemplate() {
    return template;
  }
}
