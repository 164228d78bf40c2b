/**
 * Schema-free extraction of candidates and cursors from parsed JSON responses.
 */
package ca.gc.cra.subhunt.application.extract;
