package ca.gc.cra.induform.application.pipeline;

import ca.gc.cra.induform.application.risk.VulnerabilityInfo;
import ca.gc.cra.induform.domain.compliance.ComplianceStandard;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Options for a single {@link ProjectAssessmentUseCase} run.
 *
 * @param strict whether validation warnings make the project invalid
 * @param standards standards used to filter findings; {@code null} uses the project's enabled standards and an
 *     empty set disables filtering
 * @param vulnerabilities vulnerability data keyed by zone id for risk scoring; empty when no scan is available
 * @since 0.1.0
 */
public record AssessmentOptions(
    boolean strict,
    Set<ComplianceStandard> standards,
    Map<String, List<VulnerabilityInfo>> vulnerabilities) {

  public AssessmentOptions {
    standards = standards == null ? null : Set.copyOf(standards);
    vulnerabilities = Map.copyOf(Objects.requireNonNullElse(vulnerabilities, Map.of()));
  }

  /** Non-strict run filtered by the project's own standards, without vulnerability data. */
  public static AssessmentOptions defaults() {
    return new AssessmentOptions(false, null, Map.of());
  }

  public AssessmentOptions withStrict(boolean value) {
    return new AssessmentOptions(value, standards, vulnerabilities);
  }

  public AssessmentOptions withStandards(Set<ComplianceStandard> value) {
    return new AssessmentOptions(strict, value, vulnerabilities);
  }
}
