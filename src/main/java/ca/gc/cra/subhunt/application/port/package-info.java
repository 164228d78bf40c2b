/**
 * Ports connecting the discovery pipeline to upstream sources, name resolution, output and metrics.
 * <p><strong>Role:</strong> Hexagonal boundary; application code depends only on these types.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.subhunt.application.port.HostResolver} is called from
 * worker threads; every other callback runs on the producer thread.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.subhunt.application.port;
