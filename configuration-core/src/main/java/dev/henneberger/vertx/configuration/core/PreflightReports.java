package dev.henneberger.vertx.configuration.core;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class PreflightReports {

  private PreflightReports() {
  }

  public static String describeFailure(PreflightReport report) {
    Objects.requireNonNull(report, "report");
    if (report.ok()) {
      return "Preflight passed";
    }
    return "Preflight failed: " + join(report.errors());
  }

  public static String describeWarnings(PreflightReport report) {
    Objects.requireNonNull(report, "report");
    List<PreflightIssue> warnings = report.warnings();
    if (warnings.isEmpty()) {
      return "No preflight warnings";
    }
    return "Preflight warnings: " + join(warnings);
  }

  private static String join(List<PreflightIssue> issues) {
    return issues.stream()
      .map(PreflightIssue::toString)
      .collect(Collectors.joining("; "));
  }
}
