package ca.gc.cra.ingest.infrastructure.format.xml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ingest.config.XmlStreamConfig;
import ca.gc.cra.ingest.domain.event.Event;
import ca.gc.cra.ingest.support.RecordingMetricsPort;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import javax.xml.parsers.DocumentBuilderFactory;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;

class XmlStreamFormatterTest {
  private static final String STANZA = "test_scheme://test";
  private static final String FIELDS = "<time>1372274622.493</time><index>main</index><host>localhost</host>"
      + "<source>Splunk</source><sourcetype>misc</sourcetype>";

  private final XmlStreamFormatter formatter = new XmlStreamFormatter();

  @Test
  void formatsSingleCompleteEvent() {
    List<String> streams = formatter.format(List.of(event("This is a test data3.").build()));

    assertEquals(List.of("<stream><event stanza=\"test_scheme://test\">" + FIELDS
        + "<data>This is a test data3.</data></event></stream>"), streams);
  }

  @Test
  void formatsFragmentsWithUnbrokenAndDone() {
    Event first = event("This is a test data1.").unbroken(true).build();
    Event last = event("This is a test data2.").unbroken(true).done(true).build();

    List<String> streams = formatter.format(List.of(first, last));

    assertEquals(List.of("<stream>"
        + "<event stanza=\"test_scheme://test\" unbroken=\"1\">" + FIELDS
        + "<data>This is a test data1.</data></event>"
        + "<event stanza=\"test_scheme://test\" unbroken=\"1\">" + FIELDS
        + "<data>This is a test data2.</data><done /></event>"
        + "</stream>"), streams);
  }

  @Test
  void unbrokenWithoutDoneHasNoDoneChild() {
    String xml = formatter.formatEvent(event("part").unbroken(true).build());

    assertTrue(xml.startsWith("<event stanza=\"test_scheme://test\" unbroken=\"1\">"));
    assertFalse(xml.contains("<done />"));
    assertFalse(xml.contains("unbroken=\"0\""));
  }

  @Test
  void doneIsLastChild() {
    String xml = formatter.formatEvent(event("end").done(true).build());

    assertTrue(xml.endsWith("<data>end</data><done /></event>"));
    assertFalse(xml.contains("unbroken"));
  }

  @Test
  void preservesMultiByteCharacters() {
    List<String> streams = formatter.format(List.of(event("This is utf-8 ☃ data4.").build()));

    assertEquals(List.of("<stream><event stanza=\"test_scheme://test\">" + FIELDS
        + "<data>This is utf-8 ☃ data4.</data></event></stream>"), streams);
  }

  @Test
  void omitsAbsentOptionalFields() {
    Event bare = Event.builder().data("only data").time("12.5").build();

    assertEquals("<event><time>12.5</time><data>only data</data></event>", formatter.formatEvent(bare));
  }

  @Test
  void omitsEmptyData() {
    Event empty = Event.builder().data("").time("1").stanza("s").done(true).build();

    assertEquals("<event stanza=\"s\"><time>1</time><done /></event>", formatter.formatEvent(empty));
  }

  @Test
  void rendersTimeWithoutExponent() {
    Event event = Event.builder().data("x").time("1.0E+9").build();

    assertTrue(formatter.formatEvent(event).contains("<time>1000000000</time>"));
  }

  @Test
  void escapesMarkupButKeepsNewlinesInData() {
    Event event = event("a < b && c > d\nsecond \"line\" 'q'").build();

    String xml = formatter.formatEvent(event);

    assertTrue(xml.contains("<data>a &lt; b &amp;&amp; c &gt; d\nsecond \"line\" 'q'</data>"), xml);
  }

  @Test
  void escapesAttributeValues() {
    Event event = Event.builder().data("x").time(1L).stanza("a\"b&c<d>\te\nf").build();

    String xml = formatter.formatEvent(event);

    assertTrue(xml.startsWith("<event stanza=\"a&quot;b&amp;c&lt;d&gt;&#9;e&#10;f\">"), xml);
  }

  @Test
  void replacesCharactersIllegalInXml() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    XmlStreamFormatter counting = new XmlStreamFormatter(XmlStreamConfig.defaults(), metrics);
    Event event = event("bell\u0007 null\u0000 lone\uD800 tab\tok").build();

    String xml = counting.formatEvent(event);

    assertTrue(xml.contains("<data>bell\uFFFD null\uFFFD lone\uFFFD tab\tok</data>"), xml);
    assertEquals(List.of(3L), metrics.observed("format.xml.charsReplaced"));
  }

  @Test
  void outputParsesAsXml() throws Exception {
    Event event = event("<tag attr=\"v\">&amp;</tag>\n☃").stanza("in\"put").unbroken(true).build();

    String stream = formatter.format(List.of(event)).get(0);
    Document doc = DocumentBuilderFactory.newInstance().newDocumentBuilder()
        .parse(new InputSource(new StringReader(stream)));

    Element root = doc.getDocumentElement();
    assertEquals("stream", root.getTagName());
    Element parsed = (Element) root.getElementsByTagName("event").item(0);
    assertEquals("in\"put", parsed.getAttribute("stanza"));
    assertEquals("1", parsed.getAttribute("unbroken"));
    assertEquals("<tag attr=\"v\">&amp;</tag>\n☃",
        parsed.getElementsByTagName("data").item(0).getTextContent());
  }

  @Test
  void emptyInputProducesNoStreams() {
    assertTrue(formatter.format(List.of()).isEmpty());
  }

  @Test
  void splitsOnStanzaChangeByDefault() {
    Event a1 = Event.builder().data("1").time(1L).stanza("a").build();
    Event a2 = Event.builder().data("2").time(2L).stanza("a").build();
    Event b1 = Event.builder().data("3").time(3L).stanza("b").build();
    Event a3 = Event.builder().data("4").time(4L).stanza("a").build();

    List<String> streams = formatter.format(List.of(a1, a2, b1, a3));

    assertEquals(3, streams.size());
    assertEquals("<stream>" + formatter.formatEvent(a1) + formatter.formatEvent(a2) + "</stream>",
        streams.get(0));
    assertEquals("<stream>" + formatter.formatEvent(b1) + "</stream>", streams.get(1));
    assertEquals("<stream>" + formatter.formatEvent(a3) + "</stream>", streams.get(2));
  }

  @Test
  void keepsMixedStanzasTogetherWhenSplittingDisabled() {
    XmlStreamFormatter single = new XmlStreamFormatter(new XmlStreamConfig(0, 0L, false), null);
    Event a = Event.builder().data("1").time(1L).stanza("a").build();
    Event b = Event.builder().data("2").time(2L).stanza("b").build();

    List<String> streams = single.format(List.of(a, b));

    assertEquals(1, streams.size());
    assertTrue(streams.get(0).indexOf("stanza=\"a\"") < streams.get(0).indexOf("stanza=\"b\""));
  }

  @Test
  void splitsByEventCount() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    XmlStreamFormatter chunked = new XmlStreamFormatter(new XmlStreamConfig(2, 0L, true), metrics);
    List<Event> events = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      events.add(event("event " + i).build());
    }

    List<String> streams = chunked.format(events);

    assertEquals(3, streams.size());
    assertTrue(streams.get(0).contains("event 0") && streams.get(0).contains("event 1"));
    assertTrue(streams.get(2).contains("event 4"));
    assertEquals(1, metrics.count("format.xml.calls"));
    assertEquals(List.of(3L), metrics.observed("format.xml.streams"));
    assertEquals(List.of(5L), metrics.observed("format.xml.events"));
  }

  @Test
  void splitsBySize() {
    Event first = event("first").build();
    Event second = event("second").build();
    int firstBytes = formatter.formatEvent(first).length();
    int wrapper = "<stream></stream>".length();
    XmlStreamFormatter sized =
        new XmlStreamFormatter(new XmlStreamConfig(0, wrapper + firstBytes + 5L, true), null);

    List<String> streams = sized.format(List.of(first, second));

    assertEquals(2, streams.size());
    assertEquals(wrapper + firstBytes, streams.get(0).length());
  }

  @Test
  void oversizedEventGetsItsOwnStream() {
    XmlStreamFormatter sized = new XmlStreamFormatter(new XmlStreamConfig(0, 10L, true), null);

    List<String> streams = sized.format(List.of(event("way too large").build(), event("again").build()));

    assertEquals(2, streams.size());
    assertTrue(streams.get(0).contains("way too large"));
  }

  @Test
  void sizeLimitCountsUtf8Bytes() {
    Event snowman = event("☃").build();
    String element = formatter.formatEvent(snowman);
    long exactBytes = "<stream></stream>".length() + element.length() + 2L;
    XmlStreamFormatter sized = new XmlStreamFormatter(new XmlStreamConfig(0, exactBytes, true), null);

    assertEquals(1, sized.format(List.of(snowman)).size());
    assertEquals(2, sized.format(List.of(snowman, snowman)).size());
  }

  @Test
  void rejectsNullEvents() {
    List<Event> events = new ArrayList<>();
    events.add(null);

    assertThrows(NullPointerException.class, () -> formatter.format(events));
    assertThrows(NullPointerException.class, () -> formatter.format(null));
  }

  private static Event.Builder event(String data) {
    return Event.builder()
        .data(data)
        .time(1372274622.493)
        .index("main")
        .host("localhost")
        .source("Splunk")
        .sourcetype("misc")
        .stanza(STANZA);
  }
}
