/**
 * Immutable tree model for parsed JSON documents.
 */
package ca.gc.cra.subhunt.domain.json;
