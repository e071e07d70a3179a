package com.quantori.eqp.api.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Filing form types recognised by the platform.
 */
public enum FormType {
  TEN_K("10-K"),
  TEN_Q("10-Q"),
  EIGHT_K("8-K"),
  S_1("S-1"),
  S_3("S-3"),
  S_4("S-4"),
  TWENTY_F("20-F"),
  SIX_K("6-K"),
  DEF_14A("DEF 14A"),
  DEFM14A("DEFM14A"),
  UPLOAD("UPLOAD"),
  CORRESP("CORRESP");

  private final String value;

  FormType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Resolves a form type from its official designation, ignoring case.
   *
   * @param value designation such as {@code 10-K}
   * @return matching form type
   * @throws IllegalArgumentException when nothing matches
   */
  public static FormType fromValue(String value) {
    return Arrays.stream(values())
        .filter(type -> type.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown form type: " + value));
  }

  @Override
  public String toString() {
    return value;
  }
}
