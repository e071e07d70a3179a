package com.quantori.eqp.api.model;

import lombok.Value;

@Value
public class FilingSection {
  SectionType type;
  String title;
  String text;

  public static FilingSection of(SectionType type, String text) {
    return new FilingSection(type, type.getTitle(), text);
  }
}
