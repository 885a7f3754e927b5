/**
 * Core domain model for the ingest codec: events bound for the receiving system and compressed payloads
 * awaiting decompression.
 * <p><strong>Role:</strong> Domain layer types without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Security:</strong> Payload-bearing types require downstream redaction and access controls.</p>
 */
package ca.gc.cra.ingest.domain;
