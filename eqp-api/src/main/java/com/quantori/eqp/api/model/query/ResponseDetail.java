package com.quantori.eqp.api.model.query;

public enum ResponseDetail {
  DETAILED,
  SUMMARY
}
