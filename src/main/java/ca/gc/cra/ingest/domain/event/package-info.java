/**
 * Event model shared by the XML stream and HEC formatters.
 * <p><strong>Role:</strong> Domain value types without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; builders are confined to the creating thread.</p>
 * <p><strong>Security:</strong> {@code data} carries collected payload text; log it only through truncation helpers.</p>
 */
package ca.gc.cra.ingest.domain.event;
