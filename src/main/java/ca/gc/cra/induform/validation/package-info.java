/**
 * <strong>Purpose:</strong> Validation helpers shared by the domain model, configuration bootstrap and CLI.
 * <p><strong>Role:</strong> Rejects malformed identifiers, out-of-range levels and unsafe output paths before
 * the engine or exporters run.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Enforces printable ASCII constraints to avoid control character injection in
 * identifiers and paths.
 *
 * @since 0.1.0
 */
package ca.gc.cra.induform.validation;
