/**
 * Metrics adapters that bridge SubHunt ports to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and support concurrent metric updates.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code discover.*}, {@code resolve.*}, {@code transport.*} and
 * {@code source.*} namespaces.</p>
 */
package ca.gc.cra.subhunt.infrastructure.metrics;
