/**
 * Metrics adapters implementing {@code MetricsPort}.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe; instruments are cached per metric key.</p>
 */
package ca.gc.cra.ingest.infrastructure.metrics;
