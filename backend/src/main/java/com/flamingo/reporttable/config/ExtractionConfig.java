package com.flamingo.reporttable.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for table extraction and the steps that consume its output. */
@Configuration
@ConfigurationProperties(prefix = "extraction")
@Getter
@Setter
public class ExtractionConfig {

  /** Table occurrence (1-based) extracted when a request does not name one. */
  private int defaultTableIndex = 1;

  /** Largest document, in characters, accepted by the API. */
  private long maxDocumentChars = 5_000_000L;

  private Enrichment enrichment = new Enrichment();

  /** Contact enrichment keyed on the assignment-group column. */
  @Getter
  @Setter
  public static class Enrichment {
    private boolean enabled = true;

    /** CSV with AssignmentGroup, Contact and Email columns. */
    private String contactFile = "assignment_group_contact.csv";

    private String ownerColumn = "Owner";
    private String emailColumn = "Email";
    private String notFoundValue = "Not Found";

    /**
     * Column used as assignment group when no header names it, provided its sampled values look
     * like group names.
     */
    private int defaultGroupColumn = 3;

    /** Sampled values must be longer than this to accept the default group column. */
    private int minimumGroupNameLength = 2;

    private int sampleRows = 3;
  }
}
