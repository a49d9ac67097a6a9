package com.flamingo.reporttable;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the report table extraction service. */
@SpringBootApplication
public class ReportTableApplication {

  public static void main(String[] args) {
    SpringApplication.run(ReportTableApplication.class, args);
  }
}
