package ca.gc.cra.ingest.config;

import ca.gc.cra.ingest.application.decode.PayloadDecoder;
import ca.gc.cra.ingest.application.port.MetricsPort;
import ca.gc.cra.ingest.infrastructure.compress.GzipDecompressor;
import ca.gc.cra.ingest.infrastructure.compress.ZipDecompressor;
import ca.gc.cra.ingest.infrastructure.format.hec.HecEventFormatter;
import ca.gc.cra.ingest.infrastructure.format.xml.XmlStreamFormatter;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires decompressors and formatters from a {@link CodecConfig} and a metrics port.
 * <p><strong>Why:</strong> Gives host applications one place to translate configuration into ready-to-use codec
 * components.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; every factory method returns a new, immutable
 * component.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final CodecConfig config;
  private final MetricsPort metrics;

  /**
   * Creates a composition root.
   *
   * @param config resolved codec configuration; must not be {@code null}
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public CompositionRoot(CodecConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  public CodecConfig config() {
    return config;
  }

  /**
   * Builds a decoder that sniffs gzip before zip.
   *
   * @return payload decoder over gzip and zip decompressors
   */
  public PayloadDecoder payloadDecoder() {
    return new PayloadDecoder(List.of(
        new GzipDecompressor(config.decompression(), metrics),
        new ZipDecompressor(config.decompression(), metrics)));
  }

  public XmlStreamFormatter xmlStreamFormatter() {
    return new XmlStreamFormatter(config.xml(), metrics);
  }

  public HecEventFormatter hecEventFormatter() {
    return new HecEventFormatter(config.hec(), metrics);
  }
}
