package dev.medrag.rerank;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RerankIndexParserTest {

  @Test
  void dropsDuplicatesAndOutOfRangeIndices() {
    assertThat(RerankIndexParser.parse("0, 2, 0, 9", 3, 2)).containsExactly(0, 2);
  }

  @Test
  void acceptsFullWidthAndEnumerationSeparators() {
    assertThat(RerankIndexParser.parse("4，1、3 2", 5, 4)).containsExactly(4, 1, 3, 2);
  }

  @Test
  void skipsTokensThatAreNotPlainIntegers() {
    assertThat(RerankIndexParser.parse("1, two, -3, 2.5, [0], 4", 5, 3)).containsExactly(1, 4);
  }

  @Test
  void hugeNumbersAreSkipped() {
    assertThat(RerankIndexParser.parse("99999999999999999999,1", 3, 3)).containsExactly(1);
  }

  @Test
  void stopsAtTopK() {
    assertThat(RerankIndexParser.parse("5,4,3,2,1,0", 6, 3)).containsExactly(5, 4, 3);
  }

  @Test
  void blankOrProseReplyYieldsNothing() {
    assertThat(RerankIndexParser.parse(null, 3, 2)).isEmpty();
    assertThat(RerankIndexParser.parse("  ", 3, 2)).isEmpty();
    assertThat(RerankIndexParser.parse("最相关的是第一个", 3, 2)).isEmpty();
  }
}
