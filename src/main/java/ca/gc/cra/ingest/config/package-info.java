/**
 * Configuration records and loaders for the decompression gate and event formatters.
 * <p><strong>Role:</strong> Turns YAML files or flattened key/value maps into immutable, validated records.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; loaders are stateless.</p>
 */
package ca.gc.cra.ingest.config;
