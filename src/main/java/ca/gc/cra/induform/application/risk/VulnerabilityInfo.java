package ca.gc.cra.induform.application.risk;

import ca.gc.cra.induform.validation.Strings;
import java.util.Locale;

/**
 * Known vulnerability attached to a zone by the caller, typically from a scanner import.
 *
 * @param cveId CVE identifier
 * @param severity {@code critical}, {@code high}, {@code medium} or {@code low}; lowercased
 * @param cvssScore optional CVSS base score between 0 and 10; takes precedence over {@code severity}
 * @param status {@code open}, {@code accepted}, {@code mitigated} or {@code false_positive}; defaults to open
 * @since 0.1.0
 */
public record VulnerabilityInfo(String cveId, String severity, Double cvssScore, String status) {
  public static final String STATUS_OPEN = "open";

  public VulnerabilityInfo {
    cveId = Strings.requireNonBlank("vulnerability.cve_id", cveId);
    severity = Strings.requireNonBlank("vulnerability.severity", severity).toLowerCase(Locale.ROOT);
    if (cvssScore != null && (cvssScore < 0.0 || cvssScore > 10.0 || cvssScore.isNaN())) {
      throw new IllegalArgumentException("vulnerability.cvss_score must be within [0, 10] (was " + cvssScore + ")");
    }
    status = status == null || status.isBlank() ? STATUS_OPEN : status.trim().toLowerCase(Locale.ROOT);
  }

  public static VulnerabilityInfo open(String cveId, String severity, Double cvssScore) {
    return new VulnerabilityInfo(cveId, severity, cvssScore, STATUS_OPEN);
  }
}
