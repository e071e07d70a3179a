package com.quantori.eqp.api;

import com.quantori.eqp.api.model.query.DirectLookupResult;
import com.quantori.eqp.api.model.query.FilingListPayload;
import com.quantori.eqp.api.model.query.QueryOptions;
import java.util.concurrent.CompletionStage;

/**
 * Resolves questions answerable from filing metadata alone, such as "latest 10-K filings".
 */
public interface FilingMetadataLookup {
  CompletionStage<DirectLookupResult<FilingListPayload>> lookup(String queryText, QueryOptions options);
}
