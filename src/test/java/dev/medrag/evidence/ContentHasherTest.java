package dev.medrag.evidence;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ContentHasherTest {

  @Test
  void hashesToLowercaseHexSha256() {
    assertThat(ContentHasher.sha256("hello"))
        .isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
  }

  @Test
  void identicalChineseContentHashesIdentically() {
    String content = "【感冒】\n普通感冒多由病毒引起，常见症状为鼻塞、流涕、发热。";

    assertThat(ContentHasher.sha256(content)).isEqualTo(ContentHasher.sha256(content)).hasSize(64);
  }

  @Test
  void anyDifferenceChangesTheHash() {
    assertThat(ContentHasher.sha256("发热 咳嗽")).isNotEqualTo(ContentHasher.sha256("发热  咳嗽"));
  }
}
