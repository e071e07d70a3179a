package com.quantori.eqp.api.model;

import java.util.List;
import lombok.Value;

@Value
public class FilingPage {
  List<DiscoveredFiling> filings;
  boolean lastPage;
  /**
   * Total number of filings matching the request if the source knows it, otherwise {@code null}.
   */
  Long totalCount;

  public static FilingPage of(List<DiscoveredFiling> filings, boolean lastPage) {
    return new FilingPage(filings, lastPage, null);
  }
}
