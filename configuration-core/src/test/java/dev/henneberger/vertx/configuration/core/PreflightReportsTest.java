package dev.henneberger.vertx.configuration.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class PreflightReportsTest {

  @Test
  void formatsDetailedFailureMessage() {
    PreflightReport report = new PreflightReport(List.of(
      PreflightIssue.error(
        "TABLE_MISSING",
        "Configuration table 'configuration' does not exist",
        "Create the table with key, value, version and metadata columns."),
      PreflightIssue.warning("SLOW", "Ping took 2s", null)));

    assertFalse(report.ok());
    assertTrue(report.hasIssue("TABLE_MISSING"));
    assertEquals(
      "Preflight failed: [TABLE_MISSING] Configuration table 'configuration' does not exist "
        + "Remediation: Create the table with key, value, version and metadata columns.",
      PreflightReports.describeFailure(report)
    );
    assertEquals("Preflight warnings: [SLOW] Ping took 2s", PreflightReports.describeWarnings(report));
  }

  @Test
  void passedReportHasNothingToDescribe() {
    PreflightReport report = PreflightReport.passed();

    assertTrue(report.ok());
    assertEquals("Preflight passed", PreflightReports.describeFailure(report));
    assertEquals("No preflight warnings", PreflightReports.describeWarnings(report));
  }

  @Test
  void exceptionCarriesReport() {
    PreflightReport report = new PreflightReport(List.of(
      PreflightIssue.error("COLUMNS_MISSING", "missing [metadata]", "Add the column.")));

    PreflightFailedException error = new PreflightFailedException(report);

    assertSame(report, error.report());
    assertEquals(PreflightReports.describeFailure(report), error.getMessage());
  }
}
