/**
 * Executor factories for resolver worker pools.
 * <p><strong>Role:</strong> Infrastructure utilities configuring bounded thread pools for DNS validation.</p>
 * <p><strong>Concurrency:</strong> Factory methods are thread-safe and return managed executors.</p>
 * <p><strong>Performance:</strong> Tunes queue sizes and thread naming to balance throughput and diagnostics.</p>
 */
package ca.gc.cra.subhunt.infrastructure.exec;
