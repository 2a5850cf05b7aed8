package io.b2mash.b2b.recordcore.record;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextSanitizerTest {

  @Test
  void stripsTagsAndScriptContent() {
    assertThat(TextSanitizer.plainText("<b>Bold</b> <script>alert('x')</script>name"))
        .isEqualTo("Bold name");
  }

  @Test
  void decodesEntities() {
    assertThat(TextSanitizer.plainText("Fish &amp; Chips")).isEqualTo("Fish & Chips");
  }

  @Test
  void trimsAndTurnsBlankIntoNull() {
    assertThat(TextSanitizer.plainText("  spaced  ")).isEqualTo("spaced");
    assertThat(TextSanitizer.plainText("<p>  </p>")).isNull();
    assertThat(TextSanitizer.plainText(null)).isNull();
  }
}
