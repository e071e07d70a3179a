package com.quantori.eqp.api.model;

/**
 * Logical sections of a filing that a search can be restricted to.
 */
public enum SectionType {
  BUSINESS("Business"),
  RISK_FACTORS("Risk Factors"),
  PROPERTIES("Properties"),
  LEGAL_PROCEEDINGS("Legal Proceedings"),
  MD_AND_A("Management's Discussion and Analysis"),
  MARKET_RISK("Quantitative and Qualitative Disclosures About Market Risk"),
  FINANCIAL_STATEMENTS("Financial Statements"),
  CONTROLS("Controls and Procedures"),
  ACCOUNTING_POLICIES("Accounting Policies"),
  NOTES_TO_FINANCIALS("Notes to Financial Statements"),
  EIGHT_K_EVENTS("8-K Events"),
  PROXY_GOVERNANCE("Proxy Governance"),
  /**
   * Whole document when the source cannot split it into sections.
   */
  FULL_TEXT("Full Document");

  private final String title;

  SectionType(String title) {
    this.title = title;
  }

  public String getTitle() {
    return title;
  }
}
