package ca.gc.cra.ingest.infrastructure.format.xml;

import ca.gc.cra.ingest.application.port.MetricsPort;
import ca.gc.cra.ingest.config.XmlStreamConfig;
import ca.gc.cra.ingest.domain.event.Event;
import ca.gc.cra.ingest.domain.util.Utf8;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Serializes events into {@code <stream><event>…</event></stream>} documents for the
 * receiving system's XML streaming input.
 * <p><strong>Why:</strong> The receiving parser is byte-exact about element names, attribute names and child
 * order, and reassembles {@code unbroken}/{@code done} fragments in arrival order.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Render each event with the {@code stanza} attribute, {@code unbroken="1"} only for fragments, children
 *   {@code time, index, host, source, sourcetype, data} when non-empty, and a trailing {@code <done />}.</li>
 *   <li>Split the ordered event sequence into documents according to {@link XmlStreamConfig}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Counts {@code format.xml.calls}; observes {@code format.xml.streams},
 * {@code format.xml.events} and {@code format.xml.charsReplaced}; logs a warning when illegal XML characters
 * are substituted.</p>
 *
 * @since 0.1.0
 */
public final class XmlStreamFormatter {
  private static final Logger log = LoggerFactory.getLogger(XmlStreamFormatter.class);
  private static final String STREAM_OPEN = "<stream>";
  private static final String STREAM_CLOSE = "</stream>";
  private static final long WRAPPER_BYTES = STREAM_OPEN.length() + STREAM_CLOSE.length();

  private final XmlStreamConfig config;
  private final MetricsPort metrics;

  /**
   * Creates a formatter that emits one document per contiguous stanza run.
   */
  public XmlStreamFormatter() {
    this(XmlStreamConfig.defaults(), MetricsPort.NO_OP);
  }

  /**
   * Creates a formatter with an explicit batching policy.
   *
   * @param config batching policy; must not be {@code null}
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public XmlStreamFormatter(XmlStreamConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Formats events into one or more {@code <stream>} documents, preserving input order.
   *
   * @param events ordered events; must not be {@code null} or contain {@code null}
   * @return documents in transmission order; empty when {@code events} is empty
   */
  public List<String> format(List<Event> events) {
    Objects.requireNonNull(events, "events");
    List<String> streams = new ArrayList<>();
    StringBuilder current = new StringBuilder(STREAM_OPEN);
    int eventsInCurrent = 0;
    long bytesInCurrent = WRAPPER_BYTES;
    String previousStanza = null;

    for (Event event : events) {
      Objects.requireNonNull(event, "event");
      String element = formatEvent(event);
      long elementBytes = Utf8.encodedLength(element);
      if (eventsInCurrent > 0 && startsNewStream(event, previousStanza, eventsInCurrent,
          bytesInCurrent + elementBytes)) {
        streams.add(current.append(STREAM_CLOSE).toString());
        current = new StringBuilder(STREAM_OPEN);
        eventsInCurrent = 0;
        bytesInCurrent = WRAPPER_BYTES;
      }
      current.append(element);
      eventsInCurrent++;
      bytesInCurrent += elementBytes;
      previousStanza = event.stanza();
    }
    if (eventsInCurrent > 0) {
      streams.add(current.append(STREAM_CLOSE).toString());
    }

    metrics.increment("format.xml.calls");
    metrics.observe("format.xml.events", events.size());
    metrics.observe("format.xml.streams", streams.size());
    log.debug("Formatted {} events into {} XML streams", events.size(), streams.size());
    return streams;
  }

  /**
   * Renders a single {@code <event>} element without the enclosing {@code <stream>}.
   *
   * @param event event to render; must not be {@code null}
   * @return element markup
   */
  public String formatEvent(Event event) {
    Objects.requireNonNull(event, "event");
    StringBuilder out = new StringBuilder(128 + event.data().length());
    int replaced = 0;
    out.append("<event");
    if (event.stanza() != null) {
      out.append(" stanza=\"");
      replaced += XmlText.appendAttribute(out, event.stanza());
      out.append('"');
    }
    if (event.unbroken()) {
      out.append(" unbroken=\"1\"");
    }
    out.append('>');
    replaced += appendElement(out, "time", event.time().toPlainString());
    replaced += appendElement(out, "index", event.index());
    replaced += appendElement(out, "host", event.host());
    replaced += appendElement(out, "source", event.source());
    replaced += appendElement(out, "sourcetype", event.sourcetype());
    replaced += appendElement(out, "data", event.data());
    if (event.done()) {
      out.append("<done />");
    }
    out.append("</event>");

    if (replaced > 0) {
      metrics.observe("format.xml.charsReplaced", replaced);
      log.warn("Replaced {} characters not permitted in XML for stanza {}", replaced, event.stanza());
    }
    return out.toString();
  }

  private boolean startsNewStream(
      Event event, String previousStanza, int eventsInCurrent, long bytesWithEvent) {
    if (config.splitOnStanzaChange() && !Objects.equals(previousStanza, event.stanza())) {
      return true;
    }
    if (config.maxEventsPerStream() > 0 && eventsInCurrent >= config.maxEventsPerStream()) {
      return true;
    }
    return config.maxStreamBytes() > 0 && bytesWithEvent > config.maxStreamBytes();
  }

  private static int appendElement(StringBuilder out, String name, String value) {
    if (value == null || value.isEmpty()) {
      return 0;
    }
    out.append('<').append(name).append('>');
    int replaced = XmlText.appendText(out, value);
    out.append("</").append(name).append('>');
    return replaced;
  }
}
