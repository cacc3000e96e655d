package dev.medrag.lexical;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TextTokenizerTest {

  private final TextTokenizer tokenizer = new TextTokenizer();

  @AfterEach
  void tearDown() {
    tokenizer.close();
  }

  @Test
  void hanRunsBecomeOverlappingBigrams() {
    assertThat(tokenizer.tokenize("我发热了")).containsExactly("我发", "发热", "热了");
  }

  @Test
  void whitespaceSeparatesRuns() {
    assertThat(tokenizer.tokenize("感冒 发热 咳嗽")).containsExactly("感冒", "发热", "咳嗽");
  }

  @Test
  void latinWordsAreLowerCased() {
    assertThat(tokenizer.tokenize("CT Aspirin")).containsExactly("ct", "aspirin");
  }

  @Test
  void blankTextHasNoTokens() {
    assertThat(tokenizer.tokenize(null)).isEmpty();
    assertThat(tokenizer.tokenize(" \n ")).isEmpty();
  }
}
