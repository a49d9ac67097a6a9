package com.flamingo.reporttable;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.reporttable.config.ExtractionConfig;
import com.flamingo.reporttable.service.report.ReportService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class ReportTableApplicationTests {

  @Autowired private ReportService reportService;

  @Autowired private ExtractionConfig extractionConfig;

  @Test
  void contextLoads() {
    assertThat(reportService).isNotNull();
    assertThat(extractionConfig.getEnrichment().getOwnerColumn()).isEqualTo("Owner");
  }
}
