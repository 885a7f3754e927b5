/**
 * XML streaming wire format: {@code <stream>} documents of {@code <event>} elements.
 * <p><strong>Concurrency:</strong> Formatter is immutable and safe to share.</p>
 * <p><strong>Metrics:</strong> Emits {@code format.xml.*} counters.</p>
 */
package ca.gc.cra.ingest.infrastructure.format.xml;
