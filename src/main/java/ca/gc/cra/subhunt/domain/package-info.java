/**
 * Core domain model: hostnames, resolved address sets and validated hosts.
 * <p><strong>Role:</strong> Domain layer without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe to share across threads.</p>
 */
package ca.gc.cra.subhunt.domain;
