/**
 * Logging utilities bridging CLI flags and configuration to the Logback backend.
 *
 * @since 0.1.0
 */
package ca.gc.cra.induform.logging;
