package ca.gc.cra.induform.application.resolver;

import java.util.List;

/**
 * Controls resolved for one conduit.
 *
 * @param conduitId conduit id
 * @param fromZone source zone id
 * @param toZone destination zone id
 * @param requiredSecurityLevel the higher SL-T of the two endpoints
 * @param requiresInspection whether the SL gap calls for inspection or the conduit is already flagged
 * @param requiresEncryption whether the required security level is 3 or more
 * @param allowedProtocols protocols of the conduit's flows, in flow order
 * @param recommendedControls control recommendations in precedence order
 * @since 0.1.0
 */
public record ConduitSecurityProfile(
    String conduitId,
    String fromZone,
    String toZone,
    int requiredSecurityLevel,
    boolean requiresInspection,
    boolean requiresEncryption,
    List<String> allowedProtocols,
    List<String> recommendedControls) {

  public ConduitSecurityProfile {
    allowedProtocols = List.copyOf(allowedProtocols);
    recommendedControls = List.copyOf(recommendedControls);
  }
}
