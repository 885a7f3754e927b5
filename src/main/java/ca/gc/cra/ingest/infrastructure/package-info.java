/**
 * Infrastructure adapters: {@code java.util.zip} decompressors, wire formatters, and metrics backends.
 */
package ca.gc.cra.ingest.infrastructure;
