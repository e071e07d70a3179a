package com.quantori.eqp.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Filing metadata as returned by a filing source listing. Unique by accession number.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiscoveredFiling {
  String accessionNumber;
  String companyName;
  String ticker;
  String cik;
  FormType formType;
  LocalDate filedDate;
  LocalDate reportDate;
  String documentUrl;
  Industry industry;
  Long size;
}
