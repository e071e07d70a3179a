package com.quantori.eqp.api.model;

public enum Industry {
  TECHNOLOGY,
  FINANCIAL,
  HEALTHCARE,
  ENERGY,
  CONSUMER,
  INDUSTRIAL,
  MATERIALS,
  UTILITIES,
  TELECOMMUNICATIONS,
  REAL_ESTATE
}
