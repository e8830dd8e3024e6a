package com.flamingo.ai.olivia.service.rag.generation;

import com.flamingo.ai.olivia.config.RagConfig;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the message list sent to the chat model.
 *
 * <p>Placeholders are substituted in a single pass, so braces inside the retrieved context or the
 * question are never re-interpreted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PromptFactory {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{(context|question)\\}");

  private static final List<String> ANALYTICAL_KEYWORDS =
      List.of("compare", "analyze", "difference", "relationship", "why");
  private static final List<String> DETAILED_KEYWORDS =
      List.of("explain", "describe", "how does", "what is the");

  static final int CONCISE_MAX_WORDS = 5;
  static final int CONCISE_MIN_CONTEXT_CHARS = 5000;

  private final RagConfig ragConfig;

  /**
   * Messages for an answer grounded in retrieved context.
   *
   * <p>A non-blank custom prompt replaces the template. An empty context always selects the
   * no-context template unless a custom prompt is given.
   */
  public List<ChatMessage> contextPrompt(String question, String context, String customPrompt) {
    String userPrompt;
    if (customPrompt != null && !customPrompt.isBlank()) {
      userPrompt = applyCustom(customPrompt, context, question);
    } else if (context == null || context.isBlank()) {
      log.debug("Empty context, using no-context prompt");
      userPrompt = fill(PromptTemplates.NO_CONTEXT_PROMPT, "", question);
    } else {
      PromptType type =
          ragConfig.getGeneration().isAdaptivePrompts()
              ? selectType(question, context.length())
              : PromptType.DEFAULT;
      log.debug("Using {} prompt for context of {} chars", type, context.length());
      userPrompt = fill(type.getTemplate(), context, question);
    }
    return List.of(
        SystemMessage.from(PromptTemplates.SYSTEM_PROMPT), UserMessage.from(userPrompt));
  }

  /** Messages for the retrieval-free path; {@code {context}} in a custom prompt becomes empty. */
  public List<ChatMessage> lightweightPrompt(String question, String customPrompt) {
    String userPrompt =
        customPrompt != null && !customPrompt.isBlank()
            ? applyCustom(customPrompt, "", question)
            : fill(PromptTemplates.LIGHTWEIGHT_PROMPT, "", question);
    return List.of(
        SystemMessage.from(PromptTemplates.SYSTEM_PROMPT), UserMessage.from(userPrompt));
  }

  public PromptType selectType(String question, int contextLength) {
    String lower = question.toLowerCase(Locale.ROOT);
    if (ANALYTICAL_KEYWORDS.stream().anyMatch(lower::contains)) {
      return PromptType.ANALYTICAL;
    }
    if (DETAILED_KEYWORDS.stream().anyMatch(lower::contains)) {
      return PromptType.DETAILED;
    }
    String stripped = question.strip();
    int words = stripped.isEmpty() ? 0 : stripped.split("\\s+").length;
    if (words <= CONCISE_MAX_WORDS && contextLength > CONCISE_MIN_CONTEXT_CHARS) {
      return PromptType.CONCISE;
    }
    return PromptType.DEFAULT;
  }

  private static String applyCustom(String customPrompt, String context, String question) {
    String filled = fill(customPrompt, context, question);
    if (!customPrompt.contains("{question}")) {
      filled = filled + "\n\nQuestion: " + question;
    }
    return filled;
  }

  static String fill(String template, String context, String question) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder result = new StringBuilder();
    while (matcher.find()) {
      String value = "context".equals(matcher.group(1)) ? context : question;
      matcher.appendReplacement(result, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(result);
    return result.toString();
  }
}
