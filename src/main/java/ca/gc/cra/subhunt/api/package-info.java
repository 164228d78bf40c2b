/**
 * CLI entry point that bootstraps a SubHunt discovery run.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and telemetry,
 * and invokes the discovery use case.</p>
 * <p><strong>Concurrency:</strong> Setup runs single-threaded; the resolution pipeline spawns its own workers.</p>
 * <p><strong>Output:</strong> Results go to stdout through {@link ca.gc.cra.subhunt.api.CliPrinter}; diagnostics go
 * to stderr through Logback.</p>
 */
package ca.gc.cra.subhunt.api;
