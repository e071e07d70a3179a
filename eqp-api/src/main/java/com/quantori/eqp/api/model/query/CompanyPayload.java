package com.quantori.eqp.api.model.query;

import com.quantori.eqp.api.model.DiscoveredFiling;
import java.util.List;
import java.util.Map;

/**
 * Answer data about one company.
 *
 * @param companyName resolved company name
 * @param ticker      ticker symbol if known
 * @param cik         central index key if known
 * @param filings     filings relevant to the question
 * @param facts       named values extracted by the lookup, i.e. {@code revenue -> 383.3B}
 */
public record CompanyPayload(String companyName, String ticker, String cik,
                             List<DiscoveredFiling> filings, Map<String, String> facts)
    implements QueryPayload {
}
