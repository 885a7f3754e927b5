/**
 * Full-record JSON rendering of events for diagnostics.
 */
package ca.gc.cra.ingest.infrastructure.format.json;
