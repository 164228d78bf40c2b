/**
 * Configuration records, YAML loading and composition root wiring for the SubHunt CLI.
 * <p><strong>Role:</strong> Application bootstrap layer selecting candidate sources, resolver and sinks.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Validates URLs, paths and header values through {@code ca.gc.cra.subhunt.validation}.</p>
 */
package ca.gc.cra.subhunt.config;
