package com.quantori.eqp.api.model;

public enum SortOrder {
  ASC,
  DESC
}
