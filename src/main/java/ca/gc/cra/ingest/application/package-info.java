/**
 * Application layer: use cases and the ports they depend on.
 * <p><strong>Concurrency:</strong> Services are immutable after construction.</p>
 */
package ca.gc.cra.ingest.application;
