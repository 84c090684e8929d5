package com.knowledgeagent.backend.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FrontmatterTest {

  @Test
  void splitsHeaderIncludingDelimiters() {
    Frontmatter split = Frontmatter.split("---\nphaseState: {}\n---\n\n# Raw Context\n---\nmore");

    assertThat(split.hasHeader()).isTrue();
    assertThat(split.header()).isEqualTo("---\nphaseState: {}\n---\n");
    assertThat(split.body()).isEqualTo("\n# Raw Context\n---\nmore");
  }

  @Test
  void documentWithoutOpeningDelimiterHasNoHeader() {
    Frontmatter split = Frontmatter.split("# Title\n---\nbody");

    assertThat(split.hasHeader()).isFalse();
    assertThat(split.body()).isEqualTo("# Title\n---\nbody");
  }

  @Test
  void unterminatedHeaderIsTreatedAsBody() {
    Frontmatter split = Frontmatter.split("---\nphaseState: {}\n# Title");

    assertThat(split.header()).isNull();
    assertThat(split.body()).isEqualTo("---\nphaseState: {}\n# Title");
  }

  @Test
  void nullDocumentBecomesEmptyBody() {
    assertThat(Frontmatter.split(null).body()).isEmpty();
  }
}
