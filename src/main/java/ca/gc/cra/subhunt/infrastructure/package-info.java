/**
 * Infrastructure adapters that bind SubHunt ports to external systems (HTTP APIs, DNS, files, metrics).
 * <p><strong>Role:</strong> Adapter layer implementing source, resolver, report and metrics contracts.</p>
 * <p><strong>Concurrency:</strong> Each adapter documents its guarantees; the DNS resolver runs on pool threads.</p>
 * <p><strong>Metrics:</strong> Emits namespaces such as {@code transport.*} and {@code source.*}.</p>
 */
package ca.gc.cra.subhunt.infrastructure;
