package dev.henneberger.vertx.configuration.core;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class PreflightReport {
  private final List<PreflightIssue> issues;

  public PreflightReport(List<PreflightIssue> issues) {
    this.issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
  }

  public static PreflightReport passed() {
    return new PreflightReport(Collections.emptyList());
  }

  public boolean ok() {
    return errors().isEmpty();
  }

  public List<PreflightIssue> issues() {
    return issues;
  }

  public List<PreflightIssue> errors() {
    return select(true);
  }

  public List<PreflightIssue> warnings() {
    return select(false);
  }

  public boolean hasIssue(String code) {
    return issues.stream().anyMatch(issue -> issue.code().equals(code));
  }

  private List<PreflightIssue> select(boolean errors) {
    return issues.stream()
      .filter(issue -> issue.isError() == errors)
      .collect(Collectors.toUnmodifiableList());
  }
}
