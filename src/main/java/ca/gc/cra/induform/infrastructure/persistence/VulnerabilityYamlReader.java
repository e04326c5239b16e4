package ca.gc.cra.induform.infrastructure.persistence;

import ca.gc.cra.induform.application.risk.VulnerabilityInfo;
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
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads vulnerability scan data used to weight zone risk.
 *
 * <p>The document maps zone ids to lists of findings:</p>
 * <pre>
 * plc_cell:
 *   - cve_id: CVE-2022-1234
 *     severity: high
 *     cvss_score: 8.1
 *     status: open
 * </pre>
 *
 * @since 0.1.0
 */
public final class VulnerabilityYamlReader {
  private static final Set<String> FINDING_KEYS = Set.of("cve_id", "severity", "cvss_score", "status");

  /**
   * Reads a vulnerability file.
   *
   * @param path document location
   * @return findings keyed by zone id, in document order
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is malformed
   */
  public Map<String, List<VulnerabilityInfo>> read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader, path.toString());
    }
  }

  /** Parses an in-memory vulnerability document. */
  public Map<String, List<VulnerabilityInfo>> parse(String document) {
    return read(new StringReader(Objects.requireNonNull(document, "document")), "<string>");
  }

  private Map<String, List<VulnerabilityInfo>> read(Reader reader, String source) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML vulnerabilities at " + source, ex);
    }
    if (document == null) {
      return Map.of();
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("Vulnerability document at " + source + " must map zone ids to lists");
    }
    Map<String, List<VulnerabilityInfo>> byZone = new LinkedHashMap<>();
    try {
      for (Map.Entry<?, ?> entry : root.entrySet()) {
        String zoneId = String.valueOf(entry.getKey());
        Object findings = entry.getValue();
        if (findings == null) {
          byZone.put(zoneId, List.of());
          continue;
        }
        if (!(findings instanceof List<?> list)) {
          throw new IllegalArgumentException(zoneId + " must be a list of findings");
        }
        List<VulnerabilityInfo> parsed = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
          parsed.add(toFinding(list.get(i), zoneId + "[" + i + "]"));
        }
        byZone.put(zoneId, List.copyOf(parsed));
      }
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw new IllegalArgumentException(
          "Invalid vulnerability document at " + source + ": " + ex.getMessage(), ex);
    }
    return byZone;
  }

  private static VulnerabilityInfo toFinding(Object node, String location) {
    if (!(node instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException(location + " must be a mapping");
    }
    for (Object key : map.keySet()) {
      if (!FINDING_KEYS.contains(String.valueOf(key))) {
        throw new IllegalArgumentException(location + " contains unknown key '" + key + "'");
      }
    }
    Object cvss = map.get("cvss_score");
    Double score;
    if (cvss == null) {
      score = null;
    } else if (cvss instanceof Number number) {
      score = number.doubleValue();
    } else {
      throw new IllegalArgumentException(location + ".cvss_score must be a number");
    }
    return new VulnerabilityInfo(
        text(map.get("cve_id")),
        text(map.get("severity")),
        score,
        text(map.get("status")));
  }

  private static String text(Object value) {
    return value == null ? null : value.toString();
  }
}
