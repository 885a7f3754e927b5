/**
 * Payload decoding use case composed from decompressor ports.
 */
package ca.gc.cra.ingest.application.decode;
