package com.quantori.eqp.core.search;

import lombok.Value;

/**
 * Excerpt of a cleaned section text, {@code end - start} equals the text length.
 */
@Value
public class Snippet {
  String text;
  int start;
  int end;
}
