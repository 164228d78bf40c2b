/**
 * HTTP-backed candidate sources: the paginated primary lookup and best-effort archive and certificate sources.
 */
package ca.gc.cra.subhunt.infrastructure.source;
