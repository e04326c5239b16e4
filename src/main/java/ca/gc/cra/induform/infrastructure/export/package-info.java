/**
 * Report exporters: JSON documents, terminal text and iptables-restore scripts.
 *
 * <p>Exporters are stateless renderers over engine results; they never re-run the engine.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.induform.infrastructure.export;
