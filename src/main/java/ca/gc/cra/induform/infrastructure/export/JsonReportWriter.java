package ca.gc.cra.induform.infrastructure.export;

import ca.gc.cra.induform.application.attackpath.AttackPath;
import ca.gc.cra.induform.application.attackpath.AttackPathAnalysis;
import ca.gc.cra.induform.application.attackpath.AttackPathStep;
import ca.gc.cra.induform.application.attackpath.ConduitWeakness;
import ca.gc.cra.induform.application.firewall.FirewallRule;
import ca.gc.cra.induform.application.firewall.FirewallRuleset;
import ca.gc.cra.induform.application.gap.ControlAssessment;
import ca.gc.cra.induform.application.gap.ControlStatus;
import ca.gc.cra.induform.application.gap.GapAnalysisReport;
import ca.gc.cra.induform.application.gap.ZoneGapAnalysis;
import ca.gc.cra.induform.application.pipeline.ProjectAssessment;
import ca.gc.cra.induform.application.policy.PolicyViolation;
import ca.gc.cra.induform.application.resolver.ConduitSecurityProfile;
import ca.gc.cra.induform.application.resolver.GlobalControl;
import ca.gc.cra.induform.application.resolver.ResolvedControls;
import ca.gc.cra.induform.application.resolver.SecurityControl;
import ca.gc.cra.induform.application.resolver.ZoneSecurityProfile;
import ca.gc.cra.induform.application.risk.RiskAssessment;
import ca.gc.cra.induform.application.risk.RiskFactors;
import ca.gc.cra.induform.application.risk.RiskLevel;
import ca.gc.cra.induform.application.risk.ZoneRisk;
import ca.gc.cra.induform.application.validation.ValidationReport;
import ca.gc.cra.induform.application.validation.ValidationResult;
import ca.gc.cra.induform.application.vlan.VlanAssignment;
import ca.gc.cra.induform.application.vlan.VlanMapping;
import ca.gc.cra.induform.domain.security.SecurityLevel;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Renders engine results as pretty-printed JSON documents with snake_case keys.
 * <p><strong>Why:</strong> CI pipelines and dashboards consume validation, policy, risk and control output
 * without parsing terminal text.</p>
 * <p><strong>Role:</strong> Infrastructure adapter invoked by the CLI after the engine completes.</p>
 * <p><strong>Thread-safety:</strong> {@link JsonFactory} is thread-safe; each call uses its own generator.</p>
 * <p><strong>Performance:</strong> Streams through {@link JsonGenerator} without building an intermediate tree.</p>
 *
 * @since 0.1.0
 */
public final class JsonReportWriter {
  private final JsonFactory jsonFactory = new JsonFactory();

  /** Renders a validation report. */
  public String validationReport(ValidationReport report) {
    Objects.requireNonNull(report, "report");
    return render(gen -> writeValidationReport(gen, report));
  }

  /** Renders policy violations as a JSON array. */
  public String policyViolations(List<PolicyViolation> violations) {
    Objects.requireNonNull(violations, "violations");
    return render(gen -> writePolicyViolations(gen, violations));
  }

  /** Renders a risk assessment. */
  public String riskAssessment(RiskAssessment assessment) {
    Objects.requireNonNull(assessment, "assessment");
    return render(gen -> writeRiskAssessment(gen, assessment));
  }

  /** Renders resolved security controls. */
  public String controls(ResolvedControls controls) {
    Objects.requireNonNull(controls, "controls");
    return render(gen -> writeControls(gen, controls));
  }

  /** Renders a firewall ruleset. */
  public String firewallRuleset(FirewallRuleset ruleset) {
    Objects.requireNonNull(ruleset, "ruleset");
    return render(gen -> writeFirewallRuleset(gen, ruleset));
  }

  /** Renders an attack path analysis. */
  public String attackPaths(AttackPathAnalysis analysis) {
    Objects.requireNonNull(analysis, "analysis");
    return render(gen -> writeAttackPaths(gen, analysis));
  }

  /** Renders a gap analysis report; the analysis date is written in UTC to the second. */
  public String gapAnalysis(GapAnalysisReport report) {
    Objects.requireNonNull(report, "report");
    return render(gen -> writeGapAnalysis(gen, report));
  }

  /** Renders a VLAN mapping. */
  public String vlanMapping(VlanMapping mapping) {
    Objects.requireNonNull(mapping, "mapping");
    return render(gen -> writeVlanMapping(gen, mapping));
  }

  /**
   * Renders a combined assessment with {@code project}, {@code validation}, {@code policy_violations},
   * {@code risk} and {@code controls} members.
   *
   * @param assessment combined engine output
   * @return JSON document
   */
  public String assessment(ProjectAssessment assessment) {
    Objects.requireNonNull(assessment, "assessment");
    return render(gen -> {
      gen.writeStartObject();
      gen.writeStringField("project", assessment.projectName());
      gen.writeFieldName("validation");
      writeValidationReport(gen, assessment.validation());
      gen.writeFieldName("policy_violations");
      writePolicyViolations(gen, assessment.policyViolations());
      gen.writeFieldName("risk");
      writeRiskAssessment(gen, assessment.risk());
      gen.writeFieldName("controls");
      writeControls(gen, assessment.controls());
      gen.writeEndObject();
    });
  }

  private String render(Body body) {
    StringWriter out = new StringWriter(1024);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.useDefaultPrettyPrinter();
      body.write(gen);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render JSON report", ex);
    }
    return out.toString();
  }

  private static void writeValidationReport(JsonGenerator gen, ValidationReport report) throws IOException {
    gen.writeStartObject();
    gen.writeBooleanField("valid", report.valid());
    gen.writeArrayFieldStart("results");
    for (ValidationResult result : report.results()) {
      gen.writeStartObject();
      gen.writeStringField("severity", result.severity().wireName());
      gen.writeStringField("code", result.code());
      gen.writeStringField("message", result.message());
      writeNullableString(gen, "location", result.location());
      writeNullableString(gen, "recommendation", result.recommendation());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeNumberField("error_count", report.errorCount());
    gen.writeNumberField("warning_count", report.warningCount());
    gen.writeNumberField("info_count", report.infoCount());
    gen.writeEndObject();
  }

  private static void writePolicyViolations(JsonGenerator gen, List<PolicyViolation> violations)
      throws IOException {
    gen.writeStartArray();
    for (PolicyViolation violation : violations) {
      gen.writeStartObject();
      gen.writeStringField("rule_id", violation.ruleId());
      gen.writeStringField("rule_name", violation.ruleName());
      gen.writeStringField("severity", violation.severity().wireName());
      gen.writeStringField("message", violation.message());
      writeStringArray(gen, "affected_entities", violation.affectedEntities());
      gen.writeStringField("remediation", violation.remediation());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeRiskAssessment(JsonGenerator gen, RiskAssessment assessment) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("score", assessment.score());
    gen.writeStringField("level", assessment.level().wireName());
    gen.writeNumberField("weighted_mean_score", assessment.weightedMeanScore());
    gen.writeArrayFieldStart("zone_risks");
    for (ZoneRisk zoneRisk : assessment.zoneRisks()) {
      RiskFactors factors = zoneRisk.factors();
      gen.writeStartObject();
      gen.writeStringField("zone_id", zoneRisk.zoneId());
      gen.writeNumberField("score", zoneRisk.score());
      gen.writeStringField("level", zoneRisk.level().wireName());
      gen.writeObjectFieldStart("factors");
      gen.writeNumberField("sl_base_risk", factors.slBaseRisk());
      gen.writeNumberField("asset_criticality_risk", factors.assetCriticalityRisk());
      gen.writeNumberField("exposure_risk", factors.exposureRisk());
      gen.writeNumberField("sl_gap_risk", factors.slGapRisk());
      gen.writeNumberField("vulnerability_risk", factors.vulnerabilityRisk());
      gen.writeEndObject();
      gen.writeEndObject();
    }
    gen.writeEndArray();
    writeStringArray(gen, "recommendations", assessment.recommendations());
    gen.writeEndObject();
  }

  private static void writeControls(JsonGenerator gen, ResolvedControls controls) throws IOException {
    gen.writeStartObject();
    gen.writeArrayFieldStart("zone_profiles");
    for (ZoneSecurityProfile profile : controls.zoneProfiles()) {
      gen.writeStartObject();
      gen.writeStringField("zone_id", profile.zoneId());
      gen.writeStringField("zone_name", profile.zoneName());
      gen.writeNumberField("security_level_target", profile.securityLevelTarget());
      gen.writeStringField("security_level_title", SecurityLevel.of(profile.securityLevelTarget()).title());
      writeStringArray(gen, "applicable_requirements", profile.applicableRequirements());
      gen.writeArrayFieldStart("recommended_controls");
      for (SecurityControl control : profile.recommendedControls()) {
        gen.writeStartObject();
        gen.writeStringField("requirement_id", control.requirementId());
        gen.writeStringField("requirement_name", control.requirementName());
        gen.writeStringField("control_description", control.controlDescription());
        writeStringArray(gen, "applies_to", control.appliesTo());
        gen.writeNumberField("priority", control.priority());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeArrayFieldStart("conduit_profiles");
    for (ConduitSecurityProfile profile : controls.conduitProfiles()) {
      gen.writeStartObject();
      gen.writeStringField("conduit_id", profile.conduitId());
      gen.writeStringField("from_zone", profile.fromZone());
      gen.writeStringField("to_zone", profile.toZone());
      gen.writeNumberField("required_security_level", profile.requiredSecurityLevel());
      gen.writeBooleanField("requires_inspection", profile.requiresInspection());
      gen.writeBooleanField("requires_encryption", profile.requiresEncryption());
      writeStringArray(gen, "allowed_protocols", profile.allowedProtocols());
      writeStringArray(gen, "recommended_controls", profile.recommendedControls());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeArrayFieldStart("global_controls");
    for (GlobalControl control : controls.globalControls()) {
      gen.writeStartObject();
      gen.writeStringField("control", control.control());
      gen.writeStringField("description", control.description());
      gen.writeNumberField("priority", control.priority());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeNumberField("max_security_level", controls.maxSecurityLevel());
    gen.writeEndObject();
  }

  private static void writeFirewallRuleset(JsonGenerator gen, FirewallRuleset ruleset) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("name", ruleset.name());
    writeNullableString(gen, "description", ruleset.description());
    gen.writeStringField("default_action", ruleset.defaultAction().wireName());
    gen.writeArrayFieldStart("rules");
    for (FirewallRule rule : ruleset.rules()) {
      gen.writeStartObject();
      gen.writeStringField("id", rule.id());
      gen.writeStringField("name", rule.name());
      gen.writeStringField("source_zone", rule.sourceZone());
      gen.writeStringField("destination_zone", rule.destinationZone());
      writeStringArray(gen, "source_addresses", rule.sourceAddresses());
      writeStringArray(gen, "destination_addresses", rule.destinationAddresses());
      gen.writeStringField("protocol", rule.protocol());
      if (rule.port() == null) {
        gen.writeNullField("port");
      } else {
        gen.writeNumberField("port", rule.port());
      }
      gen.writeStringField("action", rule.action().wireName());
      gen.writeBooleanField("log", rule.log());
      writeNullableString(gen, "comment", rule.comment());
      gen.writeNumberField("order", rule.order());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static void writeAttackPaths(JsonGenerator gen, AttackPathAnalysis analysis) throws IOException {
    gen.writeStartObject();
    gen.writeArrayFieldStart("paths");
    for (AttackPath path : analysis.paths()) {
      gen.writeStartObject();
      gen.writeStringField("id", path.id());
      gen.writeStringField("entry_zone_id", path.entryZoneId());
      gen.writeStringField("entry_zone_name", path.entryZoneName());
      gen.writeStringField("target_zone_id", path.targetZoneId());
      gen.writeStringField("target_zone_name", path.targetZoneName());
      gen.writeStringField("target_reason", path.targetReason());
      gen.writeArrayFieldStart("steps");
      for (AttackPathStep step : path.steps()) {
        gen.writeStartObject();
        gen.writeStringField("conduit_id", step.conduitId());
        gen.writeStringField("from_zone_id", step.fromZoneId());
        gen.writeStringField("from_zone_name", step.fromZoneName());
        gen.writeStringField("to_zone_id", step.toZoneId());
        gen.writeStringField("to_zone_name", step.toZoneName());
        gen.writeNumberField("traversal_cost", step.traversalCost());
        gen.writeArrayFieldStart("weaknesses");
        for (ConduitWeakness weakness : step.weaknesses()) {
          gen.writeStartObject();
          gen.writeStringField("type", weakness.type().wireName());
          gen.writeStringField("description", weakness.description());
          gen.writeStringField("remediation", weakness.remediation());
          gen.writeNumberField("severity_contribution", weakness.severityContribution());
          gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeNumberField("total_cost", path.totalCost());
      gen.writeNumberField("risk_score", path.riskScore());
      gen.writeStringField("risk_level", path.riskLevel().wireName());
      writeStringArray(gen, "zone_ids", path.zoneIds());
      writeStringArray(gen, "conduit_ids", path.conduitIds());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    writeStringArray(gen, "entry_points", analysis.entryPoints());
    writeStringArray(gen, "high_value_targets", analysis.highValueTargets());
    gen.writeNumberField("critical_paths", analysis.count(RiskLevel.CRITICAL));
    gen.writeNumberField("high_paths", analysis.count(RiskLevel.HIGH));
    gen.writeStringField("summary", analysis.summary());
    gen.writeEndObject();
  }

  private static void writeGapAnalysis(JsonGenerator gen, GapAnalysisReport report) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("project_name", report.projectName());
    gen.writeStringField("analysis_date",
        DateTimeFormatter.ISO_INSTANT.format(report.analysisDate().truncatedTo(ChronoUnit.SECONDS)));
    gen.writeNumberField("overall_compliance", report.overallCompliance());
    gen.writeArrayFieldStart("zones");
    for (ZoneGapAnalysis zone : report.zones()) {
      gen.writeStartObject();
      gen.writeStringField("zone_id", zone.zoneId());
      gen.writeStringField("zone_name", zone.zoneName());
      gen.writeStringField("zone_type", zone.zoneType().wireName());
      gen.writeNumberField("security_level_target", zone.securityLevelTarget());
      gen.writeNumberField("total_controls", zone.applicableControls());
      gen.writeNumberField("met_controls", zone.count(ControlStatus.MET));
      gen.writeNumberField("partial_controls", zone.count(ControlStatus.PARTIAL));
      gen.writeNumberField("unmet_controls", zone.count(ControlStatus.UNMET));
      gen.writeNumberField("compliance_percentage", zone.compliancePercentage());
      gen.writeArrayFieldStart("controls");
      for (ControlAssessment control : zone.controls()) {
        gen.writeStartObject();
        gen.writeStringField("sr_id", control.requirementId());
        gen.writeStringField("sr_name", control.requirementName());
        gen.writeStringField("fr_id", control.foundationalRequirement().id());
        gen.writeStringField("fr_name", control.foundationalRequirement().displayName());
        gen.writeStringField("status", control.status().wireName());
        gen.writeStringField("details", control.details());
        writeNullableString(gen, "remediation", control.remediation());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeObjectFieldStart("summary");
    for (ControlStatus status : ControlStatus.values()) {
      gen.writeNumberField(status.wireName(), report.count(status));
    }
    gen.writeEndObject();
    writeStringArray(gen, "priority_remediations", report.priorityRemediations());
    gen.writeEndObject();
  }

  private static void writeVlanMapping(JsonGenerator gen, VlanMapping mapping) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("project_name", mapping.projectName());
    gen.writeArrayFieldStart("assignments");
    for (VlanAssignment assignment : mapping.assignments()) {
      gen.writeStartObject();
      gen.writeStringField("zone_id", assignment.zoneId());
      gen.writeStringField("zone_name", assignment.zoneName());
      gen.writeStringField("zone_type", assignment.zoneType().wireName());
      gen.writeNumberField("vlan_id", assignment.vlanId());
      gen.writeStringField("vlan_name", assignment.vlanName());
      writeNullableString(gen, "network_segment", assignment.networkSegment());
      gen.writeNumberField("security_level", assignment.securityLevel());
      writeNullableString(gen, "description", assignment.description());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeArrayFieldStart("reserved_vlans");
    for (int vlan : mapping.reservedVlans()) {
      gen.writeNumber(vlan);
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static void writeStringArray(JsonGenerator gen, String name, List<String> values) throws IOException {
    gen.writeArrayFieldStart(name);
    for (String value : values) {
      gen.writeString(value);
    }
    gen.writeEndArray();
  }

  private static void writeNullableString(JsonGenerator gen, String name, String value) throws IOException {
    if (value == null) {
      gen.writeNullField(name);
    } else {
      gen.writeStringField(name, value);
    }
  }

  @FunctionalInterface
  private interface Body {
    void write(JsonGenerator gen) throws IOException;
  }
}
