package com.quantori.eqp.api;

import com.quantori.eqp.api.model.query.CompanyPayload;
import com.quantori.eqp.api.model.query.DirectLookupResult;
import com.quantori.eqp.api.model.query.QueryOptions;
import java.util.concurrent.CompletionStage;

/**
 * Resolves questions about one named company.
 */
public interface CompanyLookup {
  CompletionStage<DirectLookupResult<CompanyPayload>> lookup(String queryText, QueryOptions options);
}
