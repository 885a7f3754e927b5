/**
 * Logging helpers shared by decompressors and formatters.
 */
package ca.gc.cra.ingest.logging;
