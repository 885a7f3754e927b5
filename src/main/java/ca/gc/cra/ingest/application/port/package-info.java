/**
 * Ports implemented by infrastructure adapters.
 * <p><strong>Role:</strong> Boundary interfaces between the decoding service and codec or metrics backends.</p>
 * <p><strong>Concurrency:</strong> Implementations must document thread-safety; the defaults here are stateless.</p>
 */
package ca.gc.cra.ingest.application.port;
