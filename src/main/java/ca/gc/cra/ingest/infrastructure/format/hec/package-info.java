/**
 * HEC wire format: newline-delimited JSON event objects.
 * <p><strong>Concurrency:</strong> Formatter is immutable and safe to share.</p>
 * <p><strong>Metrics:</strong> Emits {@code format.hec.*} counters and histograms.</p>
 */
package ca.gc.cra.ingest.infrastructure.format.hec;
