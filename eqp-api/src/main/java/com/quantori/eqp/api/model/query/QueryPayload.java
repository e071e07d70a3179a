package com.quantori.eqp.api.model.query;

/**
 * Pattern specific data of a {@link QueryResult}.
 */
public interface QueryPayload {
}
