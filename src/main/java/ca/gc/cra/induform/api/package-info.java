/**
 * <strong>Purpose:</strong> Command-line entry points for InduForm.
 * <p><strong>Role:</strong> Parses {@code key=value} arguments and flags, merges YAML settings and defaults,
 * runs the engine through {@link ca.gc.cra.induform.config.CompositionRoot} and maps outcomes to
 * {@link ca.gc.cra.induform.api.ExitCode}.</p>
 * <p><strong>Observability:</strong> Reports go to stdout; logs go to stderr through SLF4J.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.induform.api;
