package ca.gc.cra.induform.domain.security;

import ca.gc.cra.induform.validation.Numbers;
import ca.gc.cra.induform.validation.Strings;
import java.util.Map;
import java.util.Objects;

/**
 * System requirement from IEC 62443-3-3 with the control detail expected at each security level.
 *
 * @param id requirement identifier such as {@code SR 5.1}
 * @param name requirement name
 * @param description normative description
 * @param foundationalRequirement parent category
 * @param minimumLevel lowest security level at which the requirement applies
 * @param levelDetails control detail per security level, keyed 1-4
 * @since 0.1.0
 */
public record SecurityRequirement(
    String id,
    String name,
    String description,
    FoundationalRequirement foundationalRequirement,
    int minimumLevel,
    Map<Integer, String> levelDetails) {

  public SecurityRequirement {
    id = Strings.requireNonBlank("requirement.id", id);
    name = Strings.requireNonBlank("requirement.name", name);
    description = Strings.requireNonBlank("requirement.description", description);
    foundationalRequirement = Objects.requireNonNull(foundationalRequirement, "foundationalRequirement");
    Numbers.requireRange("requirement.minimum_sl", minimumLevel, 1, 4);
    levelDetails = Map.copyOf(Objects.requireNonNull(levelDetails, "levelDetails"));
  }

  /**
   * Indicates whether the requirement applies to a zone at the given level.
   *
   * @param level security level target
   * @return {@code true} when {@code minimumLevel <= level}
   */
  public boolean appliesAt(int level) {
    return minimumLevel <= level;
  }

  /**
   * Returns the control detail for a level, falling back to the minimum level's detail.
   *
   * @param level security level
   * @return control detail, or an empty string if none is defined
   */
  public String detailFor(int level) {
    String detail = levelDetails.get(level);
    if (detail != null) {
      return detail;
    }
    return levelDetails.getOrDefault(minimumLevel, "");
  }
}
