package com.quantori.eqp.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompanyMatch {
  String companyName;
  String ticker;
  int matchCount;
  double avgScore;
}
