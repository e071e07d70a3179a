package com.quantori.eqp.api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class SearchError {
  private ErrorType type;
  private String source;
  private String itemId;
  private String message;
}
