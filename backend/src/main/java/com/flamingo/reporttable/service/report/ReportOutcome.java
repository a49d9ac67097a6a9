package com.flamingo.reporttable.service.report;

/** Result of processing one report. */
public enum ReportOutcome {
  /** A table with content was extracted. */
  EXTRACTED,
  /** The report parsed but held no table with content. Not an error. */
  NO_TABLE
}
