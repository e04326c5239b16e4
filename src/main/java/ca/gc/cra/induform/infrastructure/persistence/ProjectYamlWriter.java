package ca.gc.cra.induform.infrastructure.persistence;

import ca.gc.cra.induform.domain.compliance.ComplianceStandard;
import ca.gc.cra.induform.domain.model.Asset;
import ca.gc.cra.induform.domain.model.Conduit;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.ProjectMetadata;
import ca.gc.cra.induform.domain.model.ProtocolFlow;
import ca.gc.cra.induform.domain.model.Zone;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Serializes a {@link Project} to the snake_case YAML layout understood by {@link ProjectYamlReader}.
 *
 * <p>Null attributes are omitted and keys keep declaration order, so a written project reads back equal to the
 * original.</p>
 *
 * @since 0.1.0
 */
public final class ProjectYamlWriter {

  /**
   * Renders a project as YAML text.
   *
   * @param project project to render
   * @return YAML document
   */
  public String toYaml(Project project) {
    Objects.requireNonNull(project, "project");
    return yaml().dump(toDocument(project));
  }

  /**
   * Writes a project to a file, replacing any existing content.
   *
   * @param project project to write
   * @param path destination
   * @throws IOException when the file cannot be written
   */
  public void write(Project project, Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      writer.write(toYaml(project));
    }
  }

  private static Yaml yaml() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setSplitLines(false);
    return new Yaml(options);
  }

  static Map<String, Object> toDocument(Project project) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("version", project.version());
    root.put("project", metadata(project.metadata()));
    List<Object> zones = new ArrayList<>();
    for (Zone zone : project.zones()) {
      zones.add(zone(zone));
    }
    root.put("zones", zones);
    List<Object> conduits = new ArrayList<>();
    for (Conduit conduit : project.conduits()) {
      conduits.add(conduit(conduit));
    }
    root.put("conduits", conduits);
    return root;
  }

  private static Map<String, Object> metadata(ProjectMetadata metadata) {
    Map<String, Object> node = new LinkedHashMap<>();
    node.put("name", metadata.name());
    putIfPresent(node, "description", metadata.description());
    List<String> standards = new ArrayList<>();
    for (ComplianceStandard standard : metadata.complianceStandards()) {
      standards.add(standard.name());
    }
    node.put("compliance_standards", standards);
    if (!metadata.allowedProtocols().isEmpty()) {
      node.put("allowed_protocols", new ArrayList<>(metadata.allowedProtocols()));
    }
    putIfPresent(node, "version", metadata.version());
    putIfPresent(node, "author", metadata.author());
    return node;
  }

  private static Map<String, Object> zone(Zone zone) {
    Map<String, Object> node = new LinkedHashMap<>();
    node.put("id", zone.id());
    node.put("name", zone.name());
    node.put("type", zone.type().wireName());
    node.put("security_level_target", zone.securityLevelTarget());
    putIfPresent(node, "security_level_capability", zone.securityLevelCapability());
    putIfPresent(node, "description", zone.description());
    putIfPresent(node, "parent_zone", zone.parentZone());
    putIfPresent(node, "network_segment", zone.networkSegment());
    putIfPresent(node, "x_position", zone.xPosition());
    putIfPresent(node, "y_position", zone.yPosition());
    if (!zone.assets().isEmpty()) {
      List<Object> assets = new ArrayList<>();
      for (Asset asset : zone.assets()) {
        assets.add(asset(asset));
      }
      node.put("assets", assets);
    }
    return node;
  }

  private static Map<String, Object> asset(Asset asset) {
    Map<String, Object> node = new LinkedHashMap<>();
    node.put("id", asset.id());
    node.put("name", asset.name());
    node.put("type", asset.type().wireName());
    putIfPresent(node, "ip_address", asset.ipAddress());
    putIfPresent(node, "mac_address", asset.macAddress());
    putIfPresent(node, "vendor", asset.vendor());
    putIfPresent(node, "model", asset.model());
    putIfPresent(node, "firmware_version", asset.firmwareVersion());
    putIfPresent(node, "description", asset.description());
    node.put("criticality", asset.criticality());
    node.putAll(new TreeMap<>(asset.details()));
    return node;
  }

  private static Map<String, Object> conduit(Conduit conduit) {
    Map<String, Object> node = new LinkedHashMap<>();
    node.put("id", conduit.id());
    putIfPresent(node, "name", conduit.name());
    node.put("from_zone", conduit.fromZone());
    node.put("to_zone", conduit.toZone());
    putIfPresent(node, "security_level_required", conduit.securityLevelRequired());
    node.put("requires_inspection", conduit.requiresInspection());
    putIfPresent(node, "description", conduit.description());
    List<Object> flows = new ArrayList<>();
    for (ProtocolFlow flow : conduit.flows()) {
      Map<String, Object> flowNode = new LinkedHashMap<>();
      flowNode.put("protocol", flow.protocol());
      putIfPresent(flowNode, "port", flow.port());
      flowNode.put("direction", flow.direction().wireName());
      putIfPresent(flowNode, "description", flow.description());
      flows.add(flowNode);
    }
    node.put("flows", flows);
    return node;
  }

  private static void putIfPresent(Map<String, Object> node, String key, Object value) {
    if (value != null) {
      node.put(key, value);
    }
  }
}
