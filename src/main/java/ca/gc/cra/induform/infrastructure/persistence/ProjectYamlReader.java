package ca.gc.cra.induform.infrastructure.persistence;

import ca.gc.cra.induform.domain.compliance.ComplianceStandard;
import ca.gc.cra.induform.domain.model.Asset;
import ca.gc.cra.induform.domain.model.AssetType;
import ca.gc.cra.induform.domain.model.Conduit;
import ca.gc.cra.induform.domain.model.FlowDirection;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.ProjectMetadata;
import ca.gc.cra.induform.domain.model.ProtocolFlow;
import ca.gc.cra.induform.domain.model.Zone;
import ca.gc.cra.induform.domain.model.ZoneType;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Parses project documents (YAML, or JSON as a YAML subset) into the domain model.
 * <p><strong>Why:</strong> Projects are authored as snake_case documents; the engine only ever sees a fully
 * validated {@link Project}.</p>
 * <p><strong>Role:</strong> Infrastructure adapter used by the CLI.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject unknown keys on zones, conduits, assets and flows.</li>
 *   <li>Migrate the legacy {@code standard} metadata key to {@code compliance_standards}.</li>
 *   <li>Report malformed input with the document location of the offending node.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; a new SnakeYAML instance is created per document.</p>
 *
 * @since 0.1.0
 */
public final class ProjectYamlReader {
  private static final Logger log = LoggerFactory.getLogger(ProjectYamlReader.class);

  private static final Set<String> ROOT_KEYS = Set.of("version", "project", "zones", "conduits");
  private static final Set<String> ZONE_KEYS = Set.of(
      "id", "name", "type", "security_level_target", "security_level_capability", "description", "assets",
      "parent_zone", "network_segment", "x_position", "y_position");
  private static final Set<String> CONDUIT_KEYS = Set.of(
      "id", "name", "from_zone", "to_zone", "flows", "security_level_required", "requires_inspection",
      "description");
  private static final Set<String> FLOW_KEYS = Set.of("protocol", "port", "direction", "description");
  private static final Set<String> ASSET_FIELDS = Set.of(
      "id", "name", "type", "ip_address", "mac_address", "vendor", "model", "firmware_version", "description",
      "criticality");

  /**
   * Reads a project file.
   *
   * @param path document location
   * @return parsed project
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is malformed or violates model invariants
   */
  public Project read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Project project = read(reader, path.toString());
      log.debug("Loaded {} from {}", project, path);
      return project;
    }
  }

  /**
   * Parses a project document held in memory.
   *
   * @param document YAML or JSON text
   * @return parsed project
   */
  public Project parse(String document) {
    return read(new StringReader(Objects.requireNonNull(document, "document")), "<string>");
  }

  /**
   * Parses a project document from a reader.
   *
   * @param reader document source; not closed
   * @param source name used in error messages
   * @return parsed project
   */
  public Project read(Reader reader, String source) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML project at " + source, ex);
    }
    if (document == null) {
      throw new IllegalArgumentException("Project document at " + source + " is empty");
    }
    try {
      return toProject(asMap(document, "root"));
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw new IllegalArgumentException("Invalid project document at " + source + ": " + ex.getMessage(), ex);
    }
  }

  private static Project toProject(Map<String, Object> root) {
    rejectUnknown(root, ROOT_KEYS, "root");
    Object metadata = root.get("project");
    if (metadata == null) {
      throw new IllegalArgumentException("project section is required");
    }
    List<Zone> zones = new ArrayList<>();
    List<Object> zoneNodes = asList(root.get("zones"), "zones");
    for (int i = 0; i < zoneNodes.size(); i++) {
      zones.add(toZone(asMap(zoneNodes.get(i), "zones[" + i + "]"), "zones[" + i + "]"));
    }
    List<Conduit> conduits = new ArrayList<>();
    List<Object> conduitNodes = asList(root.get("conduits"), "conduits");
    for (int i = 0; i < conduitNodes.size(); i++) {
      conduits.add(toConduit(asMap(conduitNodes.get(i), "conduits[" + i + "]"), "conduits[" + i + "]"));
    }
    return new Project(optionalString(root, "version", "root"), toMetadata(asMap(metadata, "project")),
        zones, conduits);
  }

  private static ProjectMetadata toMetadata(Map<String, Object> node) {
    List<ComplianceStandard> standards = new ArrayList<>();
    Object declared = node.containsKey("compliance_standards")
        ? node.get("compliance_standards")
        : node.get("standard") == null ? null : List.of(node.get("standard"));
    for (Object value : asList(declared, "project.compliance_standards")) {
      standards.add(ComplianceStandard.fromId(String.valueOf(value)));
    }
    List<String> protocols = new ArrayList<>();
    for (Object value : asList(node.get("allowed_protocols"), "project.allowed_protocols")) {
      protocols.add(String.valueOf(value));
    }
    return new ProjectMetadata(
        requireString(node, "name", "project"),
        optionalString(node, "description", "project"),
        standards,
        protocols,
        optionalString(node, "version", "project"),
        optionalString(node, "author", "project"));
  }

  private static Zone toZone(Map<String, Object> node, String at) {
    rejectUnknown(node, ZONE_KEYS, at);
    List<Asset> assets = new ArrayList<>();
    List<Object> assetNodes = asList(node.get("assets"), at + ".assets");
    for (int i = 0; i < assetNodes.size(); i++) {
      String assetAt = at + ".assets[" + i + "]";
      assets.add(toAsset(asMap(assetNodes.get(i), assetAt), assetAt));
    }
    Integer slt = optionalInt(node, "security_level_target", at);
    if (slt == null) {
      throw new IllegalArgumentException(at + ".security_level_target is required");
    }
    return new Zone(
        requireString(node, "id", at),
        requireString(node, "name", at),
        ZoneType.fromWireName(requireString(node, "type", at)),
        slt,
        optionalInt(node, "security_level_capability", at),
        optionalString(node, "description", at),
        assets,
        optionalString(node, "parent_zone", at),
        optionalString(node, "network_segment", at),
        optionalDouble(node, "x_position", at),
        optionalDouble(node, "y_position", at));
  }

  private static Asset toAsset(Map<String, Object> node, String at) {
    Map<String, String> details = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : node.entrySet()) {
      String key = entry.getKey();
      if (ASSET_FIELDS.contains(key)) {
        continue;
      }
      if (!Asset.DETAIL_KEYS.contains(key)) {
        throw new IllegalArgumentException(at + " contains unknown key '" + key + "'");
      }
      if (entry.getValue() != null) {
        details.put(key, scalar(entry.getValue(), at + "." + key));
      }
    }
    Integer criticality = optionalInt(node, "criticality", at);
    return new Asset(
        requireString(node, "id", at),
        requireString(node, "name", at),
        AssetType.fromWireName(requireString(node, "type", at)),
        optionalString(node, "ip_address", at),
        optionalString(node, "mac_address", at),
        optionalString(node, "vendor", at),
        optionalString(node, "model", at),
        optionalString(node, "firmware_version", at),
        optionalString(node, "description", at),
        criticality == null ? Asset.DEFAULT_CRITICALITY : criticality,
        details);
  }

  private static Conduit toConduit(Map<String, Object> node, String at) {
    rejectUnknown(node, CONDUIT_KEYS, at);
    List<ProtocolFlow> flows = new ArrayList<>();
    List<Object> flowNodes = asList(node.get("flows"), at + ".flows");
    for (int i = 0; i < flowNodes.size(); i++) {
      String flowAt = at + ".flows[" + i + "]";
      Map<String, Object> flow = asMap(flowNodes.get(i), flowAt);
      rejectUnknown(flow, FLOW_KEYS, flowAt);
      String direction = optionalString(flow, "direction", flowAt);
      flows.add(new ProtocolFlow(
          requireString(flow, "protocol", flowAt),
          optionalInt(flow, "port", flowAt),
          direction == null ? null : FlowDirection.fromWireName(direction),
          optionalString(flow, "description", flowAt)));
    }
    return new Conduit(
        requireString(node, "id", at),
        optionalString(node, "name", at),
        requireString(node, "from_zone", at),
        requireString(node, "to_zone", at),
        flows,
        optionalInt(node, "security_level_required", at),
        optionalBoolean(node, "requires_inspection", at),
        optionalString(node, "description", at));
  }

  private static void rejectUnknown(Map<String, Object> node, Set<String> allowed, String at) {
    for (String key : node.keySet()) {
      if (!allowed.contains(key)) {
        throw new IllegalArgumentException(at + " contains unknown key '" + key + "'");
      }
    }
  }

  private static Map<String, Object> asMap(Object node, String at) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(at + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(at + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static List<Object> asList(Object node, String at) {
    if (node == null) {
      return List.of();
    }
    if (!(node instanceof List<?> raw)) {
      throw new IllegalArgumentException(at + " must be a sequence");
    }
    return new ArrayList<>(raw);
  }

  private static String scalar(Object value, String at) {
    if (value instanceof Map<?, ?> || value instanceof List<?>) {
      throw new IllegalArgumentException(at + " must be a scalar");
    }
    return String.valueOf(value);
  }

  private static String requireString(Map<String, Object> node, String key, String at) {
    String value = optionalString(node, key, at);
    if (value == null) {
      throw new IllegalArgumentException(at + "." + key + " is required");
    }
    return value;
  }

  private static String optionalString(Map<String, Object> node, String key, String at) {
    Object value = node.get(key);
    return value == null ? null : scalar(value, at + "." + key);
  }

  private static Integer optionalInt(Map<String, Object> node, String key, String at) {
    Object value = node.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Integer number) {
      return number;
    }
    if (value instanceof String text) {
      try {
        return Integer.parseInt(text.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(at + "." + key + " must be an integer (was '" + text + "')", ex);
      }
    }
    throw new IllegalArgumentException(at + "." + key + " must be an integer (was " + value + ")");
  }

  private static Double optionalDouble(Map<String, Object> node, String key, String at) {
    Object value = node.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    throw new IllegalArgumentException(at + "." + key + " must be a number (was " + value + ")");
  }

  private static boolean optionalBoolean(Map<String, Object> node, String key, String at) {
    Object value = node.get(key);
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean flag) {
      return flag;
    }
    String text = String.valueOf(value).trim();
    if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
      return Boolean.parseBoolean(text);
    }
    throw new IllegalArgumentException(at + "." + key + " must be a boolean (was " + value + ")");
  }
}
