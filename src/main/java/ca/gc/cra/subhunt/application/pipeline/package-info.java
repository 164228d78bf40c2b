/**
 * Application-level pipeline that coordinates candidate sources, wildcard detection and DNS validation.
 * <p>{@link ca.gc.cra.subhunt.application.pipeline.DiscoveryUseCase} drives a single run; it is stateful
 * per invocation and surfaces counters via {@link ca.gc.cra.subhunt.application.port.MetricsPort}.</p>
 * <p>Resolution is offloaded to an ExecutorService-backed worker pool whose threads follow the
 * {@code subhunt-resolve-*} naming convention; the producer thread owns all bookkeeping.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.subhunt.application.pipeline;
