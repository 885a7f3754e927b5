package ca.gc.cra.ingest.infrastructure.format.hec;

import ca.gc.cra.ingest.application.port.MetricsPort;
import ca.gc.cra.ingest.config.HecBatchConfig;
import ca.gc.cra.ingest.domain.event.Event;
import ca.gc.cra.ingest.domain.util.ControlChars;
import ca.gc.cra.ingest.domain.util.Utf8;
import ca.gc.cra.ingest.logging.Logs;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteFeature;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Serializes events into newline-delimited JSON batches for the HTTP Event Collector (HEC)
 * ingestion endpoint.
 * <p><strong>Why:</strong> HEC expects one compact object per event with keys {@code time, index, host, source,
 * sourcetype, event}; batches must stay under the endpoint's request size.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write optional metadata keys only when present; {@code event} is always written.</li>
 *   <li>Write {@code time} as a plain JSON number with the precision the event carries.</li>
 *   <li>Join objects with {@code \n} in input order, starting a new batch per {@link HecBatchConfig}.</li>
 * </ul>
 * <p>HEC has no representation for {@code unbroken}/{@code done}; those flags are dropped, counted as
 * {@code format.hec.fragmentFlagsDropped} and logged at debug level so the loss is visible.</p>
 * <p><strong>Thread-safety:</strong> Immutable; {@link JsonFactory} is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class HecEventFormatter {
  private static final Logger log = LoggerFactory.getLogger(HecEventFormatter.class);
  private static final int PREVIEW_BYTES = 64;

  private final HecBatchConfig config;
  private final MetricsPort metrics;
  private final JsonFactory jsonFactory = new JsonFactoryBuilder()
      .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
      .build();

  /**
   * Creates a formatter with the default 1,000,000 byte batch ceiling.
   */
  public HecEventFormatter() {
    this(HecBatchConfig.defaults(), MetricsPort.NO_OP);
  }

  /**
   * Creates a formatter with an explicit batching policy.
   *
   * @param config batching policy; must not be {@code null}
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public HecEventFormatter(HecBatchConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Formats events into newline-delimited JSON batches.
   *
   * @param events ordered events; must not be {@code null} or contain {@code null}
   * @return batches in transmission order; empty when {@code events} is empty
   */
  public List<String> format(List<Event> events) {
    Objects.requireNonNull(events, "events");
    List<String> batches = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    long currentBytes = 0L;
    int eventsInCurrent = 0;
    int fragmentFlagsDropped = 0;

    for (Event event : events) {
      Objects.requireNonNull(event, "event");
      String json = formatEvent(event);
      long jsonBytes = Utf8.encodedLength(json);
      if (eventsInCurrent > 0 && startsNewBatch(eventsInCurrent, currentBytes + 1 + jsonBytes)) {
        batches.add(current.toString());
        current.setLength(0);
        currentBytes = 0L;
        eventsInCurrent = 0;
      }
      if (eventsInCurrent > 0) {
        current.append('\n');
        currentBytes++;
      }
      current.append(json);
      currentBytes += jsonBytes;
      eventsInCurrent++;
      if (event.unbroken() || event.done()) {
        fragmentFlagsDropped++;
      }
    }
    if (eventsInCurrent > 0) {
      batches.add(current.toString());
    }

    if (fragmentFlagsDropped > 0) {
      metrics.observe("format.hec.fragmentFlagsDropped", fragmentFlagsDropped);
      log.debug("HEC format dropped unbroken/done flags from {} of {} events",
          fragmentFlagsDropped, events.size());
    }
    metrics.increment("format.hec.calls");
    metrics.observe("format.hec.events", events.size());
    metrics.observe("format.hec.batches", batches.size());
    log.debug("Formatted {} events into {} HEC batches", events.size(), batches.size());
    return batches;
  }

  /**
   * Renders a single event as one compact JSON object.
   *
   * @param event event to render; must not be {@code null}
   * @return JSON object text without a trailing newline
   */
  public String formatEvent(Event event) {
    Objects.requireNonNull(event, "event");
    String data = config.escapeControlChars()
        ? ControlChars.escapeJsonControlChars(event.data())
        : event.data();
    StringWriter out = new StringWriter(96 + data.length());
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeFieldName("time");
      gen.writeNumber(event.time());
      writeOptional(gen, "index", event.index());
      writeOptional(gen, "host", event.host());
      writeOptional(gen, "source", event.source());
      writeOptional(gen, "sourcetype", event.sourcetype());
      gen.writeStringField("event", data);
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException(
          "Failed to serialize HEC event " + Logs.truncate(event.data(), PREVIEW_BYTES), ex);
    }
    return out.toString();
  }

  private boolean startsNewBatch(int eventsInCurrent, long bytesWithEvent) {
    if (config.maxEventsPerBatch() > 0 && eventsInCurrent >= config.maxEventsPerBatch()) {
      return true;
    }
    return bytesWithEvent >= config.maxBatchBytes();
  }

  private static void writeOptional(JsonGenerator gen, String field, String value) throws IOException {
    if (value != null && !value.isEmpty()) {
      gen.writeStringField(field, value);
    }
  }
}
