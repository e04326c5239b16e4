package ca.gc.cra.induform.application.attackpath;

import ca.gc.cra.induform.application.risk.RiskLevel;
import ca.gc.cra.induform.domain.model.Asset;
import ca.gc.cra.induform.domain.model.AssetType;
import ca.gc.cra.induform.domain.model.Conduit;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.ProtocolFlow;
import ca.gc.cra.induform.domain.model.Zone;
import ca.gc.cra.induform.domain.model.ZoneType;
import ca.gc.cra.induform.validation.Numbers;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Finds the cheapest lateral movement routes from attacker entry zones to high-value zones.
 * <p><strong>Why:</strong> Zone and conduit findings are local; a path view shows which chain of weak conduits
 * actually exposes a safety system or a PLC cell.</p>
 * <p><strong>Role:</strong> Application service; pure function of the project.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pick entry zones (enterprise and DMZ, else the lowest SL-T zone) and high-value targets.</li>
 *   <li>Run Dijkstra over the undirected conduit graph, weighting each hop by attacker effort.</li>
 *   <li>Annotate every hop with conduit weaknesses and score each path from its average hop cost.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless and reentrant.</p>
 * <p><strong>Performance:</strong> O(entries &times; targets &times; conduits log zones).</p>
 *
 * @since 0.1.0
 */
public final class AttackPathAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(AttackPathAnalyzer.class);

  /** Paths reported when the caller does not choose a limit. */
  public static final int DEFAULT_MAX_PATHS = 10;

  static final Set<String> INSECURE_PROTOCOLS = Set.of("modbus_tcp", "s7comm", "profinet", "dnp3");
  static final double MIN_TRAVERSAL_COST = 1.0;
  static final int CRITICAL_ASSET_THRESHOLD = 4;
  static final int EXCESSIVE_FLOW_COUNT = 4;

  private static final Set<AssetType> CONTROL_ASSET_TYPES = EnumSet.of(AssetType.PLC, AssetType.SCADA, AssetType.DCS);
  private static final Comparator<QueueEntry> QUEUE_ORDER =
      Comparator.comparingDouble(QueueEntry::distance).thenComparing(QueueEntry::zoneId);

  public AttackPathAnalysis analyze(Project project) {
    return analyze(project, DEFAULT_MAX_PATHS);
  }

  /**
   * Analyzes attack paths.
   *
   * @param project project to analyze
   * @param maxPaths maximum number of paths to report, at least 1
   * @return analysis with the riskiest paths first
   * @throws IllegalArgumentException if {@code maxPaths} is below 1
   */
  public AttackPathAnalysis analyze(Project project, int maxPaths) {
    Objects.requireNonNull(project, "project");
    Numbers.requireRange("maxPaths", maxPaths, 1, Integer.MAX_VALUE);
    if (project.zones().isEmpty() || project.conduits().isEmpty()) {
      return new AttackPathAnalysis(List.of(), List.of(), List.of(),
          "No attack paths identified: project has no zones or conduits.");
    }

    List<Zone> entries = entryPoints(project);
    Set<String> entryIds = new HashSet<>();
    List<String> entryNames = new ArrayList<>();
    for (Zone entry : entries) {
      entryIds.add(entry.id());
      entryNames.add(entry.name());
    }
    List<Target> targets = new ArrayList<>();
    List<String> targetNames = new ArrayList<>();
    for (Target target : targets(project)) {
      if (!entryIds.contains(target.zone().id())) {
        targets.add(target);
        targetNames.add(target.zone().name());
      }
    }
    if (targets.isEmpty()) {
      return new AttackPathAnalysis(List.of(), entryNames, targetNames,
          "No attack paths identified: no valid entry/target pairs.");
    }

    Map<String, List<Edge>> graph = adjacency(project);
    List<AttackPath> paths = new ArrayList<>();
    for (Zone entry : entries) {
      for (Target target : targets) {
        cheapestRoute(project, graph, entry.id(), target.zone().id())
            .ifPresent(route -> paths.add(toPath(project, entry, target, route)));
      }
    }
    paths.sort(Comparator.comparingDouble(AttackPath::riskScore).reversed());
    List<AttackPath> reported = paths.size() > maxPaths ? paths.subList(0, maxPaths) : paths;

    AttackPathAnalysis analysis = new AttackPathAnalysis(reported, entryNames, targetNames, summarize(reported));
    log.debug("Found {} attack path(s) for {} from {} entry point(s) to {} target(s)",
        analysis.paths().size(), project, entries.size(), targets.size());
    return analysis;
  }

  /**
   * Attacker effort to cross {@code conduit} into {@code target}; lower is easier.
   *
   * @param conduit traversed conduit
   * @param target zone entered
   * @return cost, never below {@value #MIN_TRAVERSAL_COST}
   */
  static double traversalCost(Conduit conduit, Zone target) {
    double cost = 0.0;
    if (conduit.requiresInspection()) {
      cost += 30.0;
    }
    cost += 10.0 * target.securityLevelTarget();
    Integer required = conduit.securityLevelRequired();
    if (required != null) {
      if (target.securityLevelTarget() - required >= 2 && !conduit.requiresInspection()) {
        cost -= 15.0;
      }
      cost += 5.0 * required;
    } else {
      cost -= 5.0;
    }
    int flowCount = conduit.flows().size();
    if (flowCount == 0) {
      cost -= 10.0;
    } else if (flowCount > 3) {
      cost -= 2.0 * flowCount;
    }
    for (ProtocolFlow flow : conduit.flows()) {
      if (isInsecureProtocol(flow.protocol())) {
        cost -= 5.0;
      }
    }
    return Math.max(cost, MIN_TRAVERSAL_COST);
  }

  static List<ConduitWeakness> weaknesses(Conduit conduit, Zone from, Zone to) {
    List<ConduitWeakness> weaknesses = new ArrayList<>();
    int gap = Math.abs(from.securityLevelTarget() - to.securityLevelTarget());
    if (!conduit.requiresInspection() && gap >= 1) {
      weaknesses.add(new ConduitWeakness(WeaknessType.NO_INSPECTION,
          "No deep packet inspection between zones with SL gap of " + gap,
          "Enable deep packet inspection (IDS/IPS) on this conduit.",
          gap >= 2 ? 0.3 : 0.15));
    }
    if (gap >= 2) {
      weaknesses.add(new ConduitWeakness(WeaknessType.SL_GAP,
          "Security level gap of " + gap + " between " + from.name() + " (SL " + from.securityLevelTarget()
              + ") and " + to.name() + " (SL " + to.securityLevelTarget() + ")",
          "Add an intermediate DMZ zone or raise the lower zone's SL.",
          0.25));
    }
    if (conduit.flows().isEmpty()) {
      weaknesses.add(new ConduitWeakness(WeaknessType.NO_FLOWS_DEFINED,
          "No protocol flows defined; traffic is uncontrolled.",
          "Define explicit allowed protocol flows for this conduit.",
          0.2));
    }
    for (ProtocolFlow flow : conduit.flows()) {
      if (isInsecureProtocol(flow.protocol())) {
        weaknesses.add(new ConduitWeakness(WeaknessType.UNENCRYPTED_PROTOCOL,
            "Insecure protocol: " + flow.protocol() + " (no built-in encryption/auth).",
            "Migrate " + flow.protocol() + " to a secure alternative (e.g., OPC-UA with TLS) or deploy "
                + "protocol-aware firewall.",
            0.2));
      }
    }
    if (conduit.flows().size() > EXCESSIVE_FLOW_COUNT) {
      weaknesses.add(new ConduitWeakness(WeaknessType.EXCESSIVE_PROTOCOLS,
          "Excessive protocols (" + conduit.flows().size() + " flows): large attack surface.",
          "Reduce allowed flows to essential protocols only.",
          0.15));
    }
    return weaknesses;
  }

  static boolean isInsecureProtocol(String protocol) {
    return INSECURE_PROTOCOLS.contains(protocol.toLowerCase(Locale.ROOT).replace('/', '_'));
  }

  private static List<Zone> entryPoints(Project project) {
    List<Zone> entries = new ArrayList<>();
    for (Zone zone : project.zones()) {
      if (zone.type() == ZoneType.ENTERPRISE || zone.type() == ZoneType.DMZ) {
        entries.add(zone);
      }
    }
    if (entries.isEmpty()) {
      Zone weakest = project.zones().get(0);
      for (Zone zone : project.zones()) {
        if (zone.securityLevelTarget() < weakest.securityLevelTarget()) {
          weakest = zone;
        }
      }
      entries.add(weakest);
    }
    return entries;
  }

  private static List<Target> targets(Project project) {
    List<Target> targets = new ArrayList<>();
    for (Zone zone : project.zones()) {
      if (zone.type() == ZoneType.SAFETY) {
        targets.add(new Target(zone, "Safety instrumented system"));
      } else if (hasCriticalAsset(zone)) {
        targets.add(new Target(zone, "Contains critical assets (criticality >= " + CRITICAL_ASSET_THRESHOLD + ")"));
      } else if (zone.type() == ZoneType.CELL && hasControlAsset(zone)) {
        targets.add(new Target(zone, "Cell zone with PLC/SCADA/DCS assets"));
      }
    }
    return targets;
  }

  private static boolean hasCriticalAsset(Zone zone) {
    for (Asset asset : zone.assets()) {
      if (asset.criticality() >= CRITICAL_ASSET_THRESHOLD) {
        return true;
      }
    }
    return false;
  }

  private static boolean hasControlAsset(Zone zone) {
    for (Asset asset : zone.assets()) {
      if (CONTROL_ASSET_TYPES.contains(asset.type())) {
        return true;
      }
    }
    return false;
  }

  private static Map<String, List<Edge>> adjacency(Project project) {
    Map<String, List<Edge>> graph = new LinkedHashMap<>();
    for (Zone zone : project.zones()) {
      graph.put(zone.id(), new ArrayList<>());
    }
    for (Conduit conduit : project.conduits()) {
      graph.get(conduit.fromZone()).add(new Edge(conduit.toZone(), conduit));
      graph.get(conduit.toZone()).add(new Edge(conduit.fromZone(), conduit));
    }
    return graph;
  }

  private static Optional<List<Edge>> cheapestRoute(
      Project project, Map<String, List<Edge>> graph, String start, String end) {
    Map<String, Double> distances = new HashMap<>();
    Map<String, Hop> previous = new HashMap<>();
    PriorityQueue<QueueEntry> queue = new PriorityQueue<>(QUEUE_ORDER);
    distances.put(start, 0.0);
    queue.add(new QueueEntry(0.0, start));

    while (!queue.isEmpty()) {
      QueueEntry head = queue.poll();
      if (head.zoneId().equals(end)) {
        List<Edge> route = new ArrayList<>();
        String node = end;
        while (previous.containsKey(node)) {
          Hop hop = previous.get(node);
          route.add(new Edge(node, hop.conduit()));
          node = hop.fromZone();
        }
        Collections.reverse(route);
        return Optional.of(route);
      }
      if (head.distance() > distances.getOrDefault(head.zoneId(), Double.POSITIVE_INFINITY)) {
        continue;
      }
      for (Edge edge : graph.getOrDefault(head.zoneId(), List.of())) {
        double candidate = head.distance() + traversalCost(edge.conduit(), project.requireZone(edge.zoneId()));
        if (candidate < distances.getOrDefault(edge.zoneId(), Double.POSITIVE_INFINITY)) {
          distances.put(edge.zoneId(), candidate);
          previous.put(edge.zoneId(), new Hop(head.zoneId(), edge.conduit()));
          queue.add(new QueueEntry(candidate, edge.zoneId()));
        }
      }
    }
    return Optional.empty();
  }

  private static AttackPath toPath(Project project, Zone entry, Target target, List<Edge> route) {
    List<AttackPathStep> steps = new ArrayList<>();
    List<String> zoneIds = new ArrayList<>();
    List<String> conduitIds = new ArrayList<>();
    zoneIds.add(entry.id());
    double totalCost = 0.0;
    Zone from = entry;
    for (Edge edge : route) {
      Zone to = project.requireZone(edge.zoneId());
      double cost = traversalCost(edge.conduit(), to);
      steps.add(new AttackPathStep(edge.conduit().id(), from.id(), from.name(), to.id(), to.name(),
          round1(cost), weaknesses(edge.conduit(), from, to)));
      totalCost += cost;
      zoneIds.add(to.id());
      conduitIds.add(edge.conduit().id());
      from = to;
    }
    double averageCost = totalCost / steps.size();
    double riskScore = round1(Math.min(100.0, Math.max(0.0, 100.0 - (averageCost - 1.0) * 1.8)));
    Zone targetZone = target.zone();
    return new AttackPath(
        entry.id() + "->" + targetZone.id(),
        entry.id(),
        entry.name(),
        targetZone.id(),
        targetZone.name(),
        target.reason(),
        steps,
        round1(totalCost),
        riskScore,
        RiskLevel.classify(riskScore),
        zoneIds,
        conduitIds);
  }

  private static String summarize(List<AttackPath> paths) {
    if (paths.isEmpty()) {
      return "No attack paths identified between entry points and high-value targets.";
    }
    Map<RiskLevel, Integer> counts = new LinkedHashMap<>();
    for (AttackPath path : paths) {
      counts.merge(path.riskLevel(), 1, Integer::sum);
    }
    List<String> parts = new ArrayList<>();
    parts.add(paths.size() + " attack path(s) identified");
    for (RiskLevel level : List.of(RiskLevel.CRITICAL, RiskLevel.HIGH, RiskLevel.MEDIUM)) {
      Integer count = counts.get(level);
      if (count != null) {
        parts.add(count + " " + level.wireName());
      }
    }
    return String.join(", ", parts) + ".";
  }

  private static double round1(double value) {
    return Math.round(value * 10.0) / 10.0;
  }

  private record Target(Zone zone, String reason) {}

  private record Edge(String zoneId, Conduit conduit) {}

  private record Hop(String fromZone, Conduit conduit) {}

  private record QueueEntry(double distance, String zoneId) {}
}
