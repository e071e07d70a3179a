package com.quantori.eqp.core.discovery;

import com.quantori.eqp.api.model.DiscoveredFiling;
import com.quantori.eqp.api.model.DiscoveryCriteria;
import com.quantori.eqp.api.model.SortKey;
import com.quantori.eqp.api.model.SortOrder;
import java.util.Comparator;
import java.util.function.Function;
import java.util.function.Predicate;
import org.apache.commons.lang3.StringUtils;

/**
 * Client side matching and ordering of listed filings against discovery criteria.
 */
public final class FilingFilter {

  private FilingFilter() {
  }

  /**
   * Predicate accepting filings that satisfy the criteria.
   *
   * @param criteria discovery criteria
   * @param company  company a partition is narrowed to, or {@code null} to apply the allowlist of the
   *                 criteria
   */
  public static Predicate<DiscoveredFiling> matching(DiscoveryCriteria criteria, String company) {
    Predicate<DiscoveredFiling> predicate = filing -> filing.getAccessionNumber() != null
        && criteria.getFormTypes().contains(filing.getFormType());
    if (criteria.getDateRange() != null) {
      predicate = predicate.and(filing -> criteria.getDateRange().contains(filing.getFiledDate()));
    }
    if (!criteria.getIndustries().isEmpty()) {
      predicate = predicate.and(filing -> filing.getIndustry() == null
          || criteria.getIndustries().contains(filing.getIndustry()));
    }
    if (company != null) {
      predicate = predicate.and(filing -> isCompany(filing, company));
    } else if (!criteria.getCompanies().isEmpty()) {
      predicate = predicate.and(filing -> criteria.getCompanies().stream()
          .anyMatch(allowed -> isCompany(filing, allowed)));
    }
    return predicate;
  }

  /**
   * Whether the filing belongs to the company given by name, ticker or CIK.
   */
  public static boolean isCompany(DiscoveredFiling filing, String company) {
    String wanted = company.trim();
    return wanted.equalsIgnoreCase(filing.getCompanyName())
        || wanted.equalsIgnoreCase(filing.getTicker())
        || (filing.getCik() != null && StringUtils.isNumeric(wanted)
            && StringUtils.stripStart(wanted, "0").equals(StringUtils.stripStart(filing.getCik(), "0")));
  }

  /**
   * Ordering for the sort key and direction. Filings without a value for the key come last.
   */
  public static Comparator<DiscoveredFiling> ordering(SortKey sortBy, SortOrder sortOrder) {
    return switch (sortBy) {
      case COMPANY -> ordered(filing -> StringUtils.lowerCase(filing.getCompanyName()), sortOrder);
      case FILED_DATE, RELEVANCE -> ordered(DiscoveredFiling::getFiledDate, sortOrder);
    };
  }

  private static <T extends Comparable<? super T>> Comparator<DiscoveredFiling> ordered(
      Function<DiscoveredFiling, T> key, SortOrder sortOrder) {
    Comparator<T> direction = sortOrder == SortOrder.ASC ? Comparator.naturalOrder() : Comparator.reverseOrder();
    return Comparator.comparing(key, Comparator.nullsLast(direction));
  }
}
