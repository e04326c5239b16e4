package ca.gc.cra.induform.application.attackpath;

import java.util.List;
import java.util.Objects;

/**
 * Traversal of one conduit on an attack path.
 *
 * @param conduitId traversed conduit
 * @param fromZoneId zone the attacker leaves
 * @param fromZoneName display name of {@code fromZoneId}
 * @param toZoneId zone the attacker enters
 * @param toZoneName display name of {@code toZoneId}
 * @param traversalCost attacker effort for this step, rounded to one decimal; lower is easier
 * @param weaknesses weaknesses found on the conduit
 * @since 0.1.0
 */
public record AttackPathStep(
    String conduitId,
    String fromZoneId,
    String fromZoneName,
    String toZoneId,
    String toZoneName,
    double traversalCost,
    List<ConduitWeakness> weaknesses) {

  public AttackPathStep {
    conduitId = Objects.requireNonNull(conduitId, "conduitId");
    fromZoneId = Objects.requireNonNull(fromZoneId, "fromZoneId");
    toZoneId = Objects.requireNonNull(toZoneId, "toZoneId");
    weaknesses = List.copyOf(weaknesses);
  }
}
