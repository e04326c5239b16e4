package ca.gc.cra.induform.application.firewall;

import ca.gc.cra.induform.domain.model.Asset;
import ca.gc.cra.induform.domain.model.Conduit;
import ca.gc.cra.induform.domain.model.FlowDirection;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.ProtocolFlow;
import ca.gc.cra.induform.domain.model.Zone;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Derives a default-deny firewall ruleset from conduit flows.
 * <p><strong>Why:</strong> Conduits already declare the permitted traffic; translating them into allow rules
 * followed by explicit zone-pair denies gives a reviewable starting configuration.</p>
 * <p><strong>Thread-safety:</strong> Stateless and reentrant.</p>
 *
 * @since 0.1.0
 */
public final class FirewallRuleGenerator {
  private static final Logger log = LoggerFactory.getLogger(FirewallRuleGenerator.class);

  static final int ALLOW_ORDER_STEP = 10;
  static final int DENY_ORDER_BASE = 9000;

  public FirewallRuleset generate(Project project) {
    return generate(project, FirewallOptions.DEFAULTS);
  }

  /**
   * Generates the ruleset.
   *
   * @param project source project
   * @param options generation options
   * @return ruleset with allow rules in conduit and flow order, followed by deny rules when enabled
   */
  public FirewallRuleset generate(Project project, FirewallOptions options) {
    Objects.requireNonNull(project, "project");
    Objects.requireNonNull(options, "options");
    Map<String, List<String>> addresses = zoneAddresses(project);
    List<FirewallRule> rules = new ArrayList<>();
    int counter = 1;

    for (Conduit conduit : project.conduits()) {
      Zone from = project.requireZone(conduit.fromZone());
      Zone to = project.requireZone(conduit.toZone());
      for (ProtocolFlow flow : conduit.flows()) {
        if (flow.direction() == FlowDirection.OUTBOUND || flow.direction() == FlowDirection.BIDIRECTIONAL) {
          rules.add(allow(counter++, conduit.id() + "-" + flow.protocol() + "-out", from, to, flow, addresses, options));
        }
        if (flow.direction() == FlowDirection.INBOUND || flow.direction() == FlowDirection.BIDIRECTIONAL) {
          rules.add(allow(counter++, conduit.id() + "-" + flow.protocol() + "-in", to, from, flow, addresses, options));
        }
      }
    }

    if (options.includeDenyRules()) {
      for (Zone source : project.zones()) {
        for (Zone destination : project.zones()) {
          if (source.id().equals(destination.id())) {
            continue;
          }
          rules.add(new FirewallRule(
              ruleId(counter),
              "deny-" + source.id() + "-to-" + destination.id(),
              source.id(),
              destination.id(),
              List.of(),
              List.of(),
              FirewallRule.ANY,
              null,
              FirewallAction.DENY,
              options.logDenied(),
              "Default deny from " + source.id() + " to " + destination.id(),
              DENY_ORDER_BASE + counter));
          counter++;
        }
      }
    }

    String name = project.metadata().name();
    log.debug("Generated {} firewall rule(s) for {}", rules.size(), project);
    return new FirewallRuleset(
        name + " Firewall Rules",
        "Auto-generated firewall rules for " + name,
        FirewallAction.DENY,
        rules);
  }

  private static FirewallRule allow(
      int counter,
      String name,
      Zone source,
      Zone destination,
      ProtocolFlow flow,
      Map<String, List<String>> addresses,
      FirewallOptions options) {
    return new FirewallRule(
        ruleId(counter),
        name,
        source.id(),
        destination.id(),
        addresses.getOrDefault(source.id(), List.of(FirewallRule.ANY)),
        addresses.getOrDefault(destination.id(), List.of(FirewallRule.ANY)),
        flow.protocol(),
        flow.port(),
        FirewallAction.ALLOW,
        options.logAllowed(),
        "Allow " + flow.protocol() + " from " + source.name() + " to " + destination.name(),
        counter * ALLOW_ORDER_STEP);
  }

  private static String ruleId(int counter) {
    return String.format(Locale.ROOT, "rule-%04d", counter);
  }

  private static Map<String, List<String>> zoneAddresses(Project project) {
    Map<String, List<String>> map = new HashMap<>();
    for (Zone zone : project.zones()) {
      List<String> ips = new ArrayList<>();
      for (Asset asset : zone.assets()) {
        if (asset.ipAddress() != null) {
          ips.add(asset.ipAddress());
        }
      }
      if (!ips.isEmpty()) {
        map.put(zone.id(), List.copyOf(ips));
      }
    }
    return map;
  }
}
