package com.quantori.eqp.core.search;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class SnippetExtractorTest {
  private final SnippetExtractor extractor = new SnippetExtractor();

  @Test
  void shortTextIsReturnedWhole() {
    String text = "Revenue recognition policies changed.";

    Snippet snippet = extractor.extract(text, TermMatches.find(text, List.of("revenue")), 200);

    assertThat(snippet.getText()).isEqualTo(text);
    assertThat(snippet.getStart()).isZero();
  }

  @Test
  void windowCentersOnDensestCluster() {
    String filler = "lorem ipsum dolor sit amet ".repeat(20);
    String text = filler + "single revenue mention " + filler
        + "our revenue recognition policy follows revenue recognition guidance " + filler;
    List<String> terms = List.of("revenue", "recognition");

    Snippet snippet = extractor.extract(text, TermMatches.find(text, terms), 80);

    assertThat(snippet.getText()).contains("revenue recognition policy");
    assertThat(snippet.getText().length()).isLessThanOrEqualTo(80);
    assertThat(text.substring(snippet.getStart(), snippet.getEnd())).isEqualTo(snippet.getText());
  }

  @Test
  void snippetStartsAndEndsOnWordBoundaries() {
    String text = "alpha beta gamma delta epsilon zeta eta theta iota kappa lambda revenue mu nu xi omicron "
        + "pi rho sigma tau upsilon phi chi psi omega";

    Snippet snippet = extractor.extract(text, TermMatches.find(text, List.of("revenue")), 30);

    assertThat(snippet.getText()).contains("revenue");
    assertThat(snippet.getText()).doesNotStartWith(" ").doesNotEndWith(" ");
    assertThat(snippet.getStart() == 0 || text.charAt(snippet.getStart() - 1) == ' ').isTrue();
    assertThat(snippet.getEnd() == text.length() || text.charAt(snippet.getEnd()) == ' ').isTrue();
    assertThat(snippet.getText().length()).isLessThanOrEqualTo(30);
  }

  @Test
  void beginningOfTextWithoutMatches() {
    String text = "word ".repeat(100).trim();

    Snippet snippet = extractor.extract(text, TermMatches.find(text, List.of("revenue")), 23);

    assertThat(snippet.getStart()).isZero();
    assertThat(snippet.getText()).isEqualTo("word word word word");
  }
}
