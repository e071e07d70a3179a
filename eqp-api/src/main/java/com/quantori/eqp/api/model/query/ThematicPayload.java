package com.quantori.eqp.api.model.query;

import com.quantori.eqp.api.model.ThematicSearchResult;

public record ThematicPayload(ThematicSearchResult search) implements QueryPayload {
}
