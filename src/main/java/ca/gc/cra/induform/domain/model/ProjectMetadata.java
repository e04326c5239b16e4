package ca.gc.cra.induform.domain.model;

import ca.gc.cra.induform.domain.compliance.ComplianceStandard;
import ca.gc.cra.induform.validation.Strings;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Descriptive project metadata plus the compliance and protocol settings that scope engine output.
 *
 * @param name project name
 * @param description optional description
 * @param complianceStandards enabled frameworks in declaration order; never empty, defaults to IEC 62443
 * @param allowedProtocols additional approved protocol names; matched case-insensitively
 * @param version optional project revision label
 * @param author optional author
 * @since 0.1.0
 */
public record ProjectMetadata(
    String name,
    String description,
    List<ComplianceStandard> complianceStandards,
    List<String> allowedProtocols,
    String version,
    String author) {

  /** Frameworks enabled when a project does not declare any. */
  public static final List<ComplianceStandard> DEFAULT_STANDARDS = List.of(ComplianceStandard.IEC62443);

  /**
   * Validates the name, deduplicates standards and normalizes protocol names.
   *
   * @throws IllegalArgumentException if the name is blank or a protocol entry is blank
   */
  public ProjectMetadata {
    name = Strings.requireNonBlank("project.name", name);
    description = Strings.optional("project.description", description);
    if (complianceStandards == null || complianceStandards.isEmpty()) {
      complianceStandards = DEFAULT_STANDARDS;
    } else {
      complianceStandards = List.copyOf(new LinkedHashSet<>(complianceStandards));
    }
    List<String> protocols = new ArrayList<>();
    if (allowedProtocols != null) {
      for (String protocol : allowedProtocols) {
        protocols.add(Strings.requireNonBlank("project.allowed_protocols", protocol));
      }
    }
    allowedProtocols = List.copyOf(protocols);
    version = Strings.optional("project.version", version);
    author = Strings.optional("project.author", author);
  }

  /**
   * Creates metadata with defaults for everything except the name.
   *
   * @param name project name
   * @return new metadata
   */
  public static ProjectMetadata named(String name) {
    return new ProjectMetadata(name, null, DEFAULT_STANDARDS, List.of(), null, null);
  }

  /**
   * Returns the enabled standards as a set for filtering.
   *
   * @return immutable set of enabled standards
   */
  public Set<ComplianceStandard> enabledStandards() {
    return Set.copyOf(complianceStandards);
  }
}
