package com.quantori.eqp.api.model;

import java.util.List;
import lombok.Value;

/**
 * Text content of one filing split into sections. May contain markup, it is cleaned before scoring.
 */
@Value
public class FilingContent {
  String accessionNumber;
  List<FilingSection> sections;
}
