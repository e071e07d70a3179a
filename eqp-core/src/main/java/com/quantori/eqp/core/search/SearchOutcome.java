package com.quantori.eqp.core.search;

import com.quantori.eqp.api.model.SearchError;
import com.quantori.eqp.api.model.SearchResult;
import java.util.List;
import lombok.Value;

@Value
public class SearchOutcome {
  List<SearchResult> results;
  int filingsScanned;
  List<SearchError> errors;
  boolean cancelled;
}
