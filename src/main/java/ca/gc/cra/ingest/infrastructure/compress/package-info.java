/**
 * Gzip and zip decompressors backing the {@code PayloadDecompressor} port.
 * <p><strong>Role:</strong> Adapter layer over {@code java.util.zip}; all work happens on in-memory buffers.</p>
 * <p><strong>Concurrency:</strong> Decompressors are immutable and safe to share.</p>
 * <p><strong>Metrics:</strong> Emits {@code decompress.<format>.*} counters and byte histograms.</p>
 * <p><strong>Security:</strong> Inflated output is capped by {@code DecompressionConfig}; multi-entry archives are
 * rejected.</p>
 */
package ca.gc.cra.ingest.infrastructure.compress;
