package com.quantori.eqp.api.model.query;

import com.quantori.eqp.api.model.DiscoveredFiling;
import java.util.List;

public record FilingListPayload(List<DiscoveredFiling> filings) implements QueryPayload {
}
