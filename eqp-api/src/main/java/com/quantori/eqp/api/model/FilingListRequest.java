package com.quantori.eqp.api.model;

import lombok.Builder;
import lombok.Value;

/**
 * Request for one page of a filing listing.
 *
 * <p>When {@link #company} is set the listing is narrowed to that company, the company allowlist of
 * the criteria should be ignored by the source. Pages are numbered from zero.
 */
@Value
@Builder
public class FilingListRequest {
  DiscoveryCriteria criteria;
  String company;
  int page;
  int pageSize;
}
