package com.flamingo.ai.olivia.service.rag.generation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.olivia.config.RagConfig;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PromptFactory Tests")
class PromptFactoryTest {

  private RagConfig ragConfig;
  private PromptFactory promptFactory;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    promptFactory = new PromptFactory(ragConfig);
  }

  private static String userText(List<ChatMessage> messages) {
    return ((UserMessage) messages.get(1)).singleText();
  }

  @Test
  @DisplayName("Should lead with the system prompt")
  void shouldLeadWithSystemPrompt() {
    List<ChatMessage> messages = promptFactory.contextPrompt("q", "ctx", null);

    assertThat(messages).hasSize(2);
    assertThat(((SystemMessage) messages.get(0)).text()).isEqualTo(PromptTemplates.SYSTEM_PROMPT);
  }

  @Test
  @DisplayName("Should fill the default template with context and question")
  void shouldFillDefaultTemplate() {
    String prompt =
        userText(promptFactory.contextPrompt("What is X?", "[Source: a]\nX is Y", null));

    assertThat(prompt).contains("[Source: a]\nX is Y").contains("What is X?");
    assertThat(prompt).doesNotContain("{context}").doesNotContain("{question}");
  }

  @Test
  @DisplayName("Should switch to the no-context template when nothing was retrieved")
  void shouldUseNoContextTemplate() {
    String prompt = userText(promptFactory.contextPrompt("Anything?", "", null));

    assertThat(prompt)
        .isEqualTo(PromptTemplates.NO_CONTEXT_PROMPT.replace("{question}", "Anything?"));
  }

  @Nested
  @DisplayName("Custom prompts")
  class CustomPrompts {

    @Test
    @DisplayName("Should substitute both placeholders")
    void shouldSubstitutePlaceholders() {
      String prompt =
          userText(promptFactory.contextPrompt("Q1", "C1", "Use {context} to answer {question}"));

      assertThat(prompt).isEqualTo("Use C1 to answer Q1");
    }

    @Test
    @DisplayName("Should append the question when the prompt has no question placeholder")
    void shouldAppendQuestion() {
      String prompt = userText(promptFactory.contextPrompt("Q1", "C1", "Context: {context}"));

      assertThat(prompt).isEqualTo("Context: C1\n\nQuestion: Q1");
    }

    @Test
    @DisplayName("Should not re-expand placeholders found inside the context")
    void shouldSubstituteInSinglePass() {
      String prompt =
          userText(
              promptFactory.contextPrompt("Q1", "literal {question} $1", "{context}|{question}"));

      assertThat(prompt).isEqualTo("literal {question} $1|Q1");
    }

    @Test
    @DisplayName("Should blank the context placeholder on the lightweight path")
    void shouldBlankContextWhenLightweight() {
      String prompt = userText(promptFactory.lightweightPrompt("Q1", "[{context}] {question}"));

      assertThat(prompt).isEqualTo("[] Q1");
    }
  }

  @Test
  @DisplayName("Should use the lightweight template without a custom prompt")
  void shouldUseLightweightTemplate() {
    assertThat(userText(promptFactory.lightweightPrompt("Hi there", null)))
        .contains("Question: Hi there");
  }

  @Nested
  @DisplayName("Adaptive selection")
  class AdaptiveSelection {

    @Test
    @DisplayName("Should pick templates by question wording and context size")
    void shouldSelectByWording() {
      assertThat(promptFactory.selectType("Compare plan A and plan B", 100))
          .isEqualTo(PromptType.ANALYTICAL);
      assertThat(promptFactory.selectType("Explain the billing cycle", 100))
          .isEqualTo(PromptType.DETAILED);
      assertThat(promptFactory.selectType("pricing tiers", 6000)).isEqualTo(PromptType.CONCISE);
      assertThat(promptFactory.selectType("pricing tiers", 100)).isEqualTo(PromptType.DEFAULT);
    }

    @Test
    @DisplayName("Should only adapt when enabled")
    void shouldOnlyAdaptWhenEnabled() {
      String question = "Compare plan A and plan B";

      String fixed = userText(promptFactory.contextPrompt(question, "ctx", null));
      ragConfig.getGeneration().setAdaptivePrompts(true);
      String adapted = userText(promptFactory.contextPrompt(question, "ctx", null));

      assertThat(fixed)
          .isEqualTo(PromptFactory.fill(PromptTemplates.DEFAULT_RAG_PROMPT, "ctx", question));
      assertThat(adapted)
          .isEqualTo(PromptFactory.fill(PromptTemplates.ANALYTICAL_RAG_PROMPT, "ctx", question));
    }
  }
}
