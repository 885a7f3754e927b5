package ca.gc.cra.ingest.infrastructure.format.json;

import ca.gc.cra.ingest.domain.event.Event;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteFeature;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Renders every field of an {@link Event}, fragment flags and stanza included, as one JSON object.
 *
 * <p>Intended for diagnostics and audit output rather than ingestion: keys are written in alphabetical order
 * ({@code data, done, host, index, source, sourcetype, stanza, time, unbroken}) and absent metadata is written
 * as {@code null}.</p>
 *
 * @since 0.1.0
 */
public final class EventJsonWriter {
  private final JsonFactory jsonFactory = new JsonFactoryBuilder()
      .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
      .build();

  /**
   * Serializes the full event record.
   *
   * @param event event to render; must not be {@code null}
   * @return compact JSON object
   */
  public String toJson(Event event) {
    Objects.requireNonNull(event, "event");
    StringWriter out = new StringWriter(160 + event.data().length());
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("data", event.data());
      gen.writeBooleanField("done", event.done());
      gen.writeStringField("host", event.host());
      gen.writeStringField("index", event.index());
      gen.writeStringField("source", event.source());
      gen.writeStringField("sourcetype", event.sourcetype());
      gen.writeStringField("stanza", event.stanza());
      gen.writeFieldName("time");
      gen.writeNumber(event.time());
      gen.writeBooleanField("unbroken", event.unbroken());
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to serialize event record", ex);
    }
    return out.toString();
  }
}
