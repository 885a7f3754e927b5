/**
 * Domain utility classes for text encoding helpers.
 * <p><strong>Concurrency:</strong> Utilities are stateless; safe to call concurrently.</p>
 * <p><strong>Metrics:</strong> Do not emit metrics; callers observe usage.</p>
 */
package ca.gc.cra.ingest.domain.util;
