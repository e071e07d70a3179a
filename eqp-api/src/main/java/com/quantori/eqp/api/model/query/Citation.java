package com.quantori.eqp.api.model.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.quantori.eqp.api.model.FormType;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Citation {
  String filingUrl;
  String accessionNumber;
  String companyName;
  FormType formType;
  LocalDate filedDate;
  String section;
  String snippet;
  Integer startChar;
  Integer endChar;
  String text;
}
