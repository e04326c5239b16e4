package ca.gc.cra.induform.domain.model;

import ca.gc.cra.induform.validation.Numbers;
import ca.gc.cra.induform.validation.Strings;

/**
 * Single permitted protocol flow carried by a conduit.
 *
 * @param protocol protocol name (e.g. {@code modbus_tcp}); compared case-insensitively against allowlists
 * @param port optional transport port between 1 and 65535
 * @param direction flow direction relative to the conduit; defaults to {@link FlowDirection#BIDIRECTIONAL}
 * @param description optional purpose of the flow
 * @since 0.1.0
 */
public record ProtocolFlow(String protocol, Integer port, FlowDirection direction, String description) {

  /**
   * Validates the protocol name and port range.
   *
   * @throws IllegalArgumentException if the protocol is blank or the port is out of range
   */
  public ProtocolFlow {
    protocol = Strings.requireNonBlank("flow.protocol", protocol);
    Numbers.requireOptionalRange("flow.port", port, 1, 65_535);
    direction = direction == null ? FlowDirection.BIDIRECTIONAL : direction;
    description = Strings.optional("flow.description", description);
  }

  /**
   * Creates a bidirectional flow without a description.
   *
   * @param protocol protocol name
   * @param port optional port
   * @return new flow
   */
  public static ProtocolFlow of(String protocol, Integer port) {
    return new ProtocolFlow(protocol, port, FlowDirection.BIDIRECTIONAL, null);
  }
}
