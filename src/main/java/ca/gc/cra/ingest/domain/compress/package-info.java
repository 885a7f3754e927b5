/**
 * Compressed payload model and the failure taxonomy of the decompression gate.
 * <p><strong>Role:</strong> Domain types consumed by {@code application.port.PayloadDecompressor} implementations.</p>
 * <p><strong>Concurrency:</strong> Immutable; safe to share across threads.</p>
 * <p><strong>Security:</strong> Payloads are untrusted until a decompressor has validated them.</p>
 */
package ca.gc.cra.ingest.domain.compress;
