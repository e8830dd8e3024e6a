package com.flamingo.ai.olivia.service.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("QueryExpander Tests")
class QueryExpanderTest {

  private final QueryExpander expander = new QueryExpander();

  @Test
  @DisplayName("Should return original followed by at most three synonym variants")
  void shouldExpandShortQuery() {
    List<String> variants = expander.expand("show example");

    assertThat(variants)
        .containsExactly("show example", "show instance", "show sample", "display example");
  }

  @Test
  @DisplayName("Should leave single-word queries alone")
  void shouldNotExpandSingleWord() {
    assertThat(expander.expand("example")).containsExactly("example");
  }

  @Test
  @DisplayName("Should leave queries longer than four words alone")
  void shouldNotExpandLongQuery() {
    String query = "show me an example please now";

    assertThat(expander.expand(query)).containsExactly(query);
  }

  @Test
  @DisplayName("Should return only the original when no word has synonyms")
  void shouldReturnOriginalWithoutSynonyms() {
    assertThat(expander.expand("quarterly revenue")).containsExactly("quarterly revenue");
  }

  @Test
  @DisplayName("Should keep the caller's casing for the original query")
  void shouldKeepOriginalCasing() {
    List<String> variants = expander.expand("Find Problem");

    assertThat(variants.get(0)).isEqualTo("Find Problem");
    assertThat(variants).hasSize(4).doesNotContain("find problem");
  }
}
