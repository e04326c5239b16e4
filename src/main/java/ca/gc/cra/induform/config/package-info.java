/**
 * Configuration records and composition root wiring for InduForm CLIs.
 * <p><strong>Role:</strong> Bootstrap layer translating {@code key=value} arguments and optional YAML settings
 * into typed per-command configuration and wiring the engine to its adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Paths are normalized before use; output targets are further checked by
 * {@code ca.gc.cra.induform.validation.Paths}.</p>
 */
package ca.gc.cra.induform.config;
