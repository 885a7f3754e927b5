/**
 * Input validation helpers shared by configuration records.
 * <p><strong>Concurrency:</strong> Stateless utilities; safe for concurrent use.</p>
 */
package ca.gc.cra.ingest.validation;
