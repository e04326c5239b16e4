package ca.gc.cra.induform.application.attackpath;

import ca.gc.cra.induform.application.risk.RiskLevel;
import java.util.List;
import java.util.Objects;

/**
 * Result of an attack path analysis.
 *
 * @param paths paths ordered by descending risk score, truncated to the requested maximum
 * @param entryPoints names of the zones treated as attacker entry points
 * @param highValueTargets names of the zones treated as targets
 * @param summary one-line human readable summary
 * @since 0.1.0
 */
public record AttackPathAnalysis(
    List<AttackPath> paths,
    List<String> entryPoints,
    List<String> highValueTargets,
    String summary) {

  public AttackPathAnalysis {
    paths = List.copyOf(paths);
    entryPoints = List.copyOf(entryPoints);
    highValueTargets = List.copyOf(highValueTargets);
    summary = Objects.requireNonNull(summary, "summary");
  }

  /**
   * Counts reported paths at one risk level.
   *
   * @param level risk level
   * @return number of paths classified at {@code level}
   */
  public int count(RiskLevel level) {
    int count = 0;
    for (AttackPath path : paths) {
      if (path.riskLevel() == level) {
        count++;
      }
    }
    return count;
  }
}
