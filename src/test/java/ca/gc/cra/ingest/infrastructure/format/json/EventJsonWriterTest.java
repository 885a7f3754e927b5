package ca.gc.cra.ingest.infrastructure.format.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.ingest.domain.event.Event;
import org.junit.jupiter.api.Test;

class EventJsonWriterTest {
  private final EventJsonWriter writer = new EventJsonWriter();

  @Test
  void writesEveryFieldInAlphabeticalOrder() {
    Event event = Event.builder()
        .data("This is a test data1.")
        .time(1372274622.493)
        .index("main")
        .host("localhost")
        .source("Splunk")
        .sourcetype("misc")
        .stanza("test_scheme://test")
        .unbroken(true)
        .done(true)
        .build();

    assertEquals("{\"data\":\"This is a test data1.\",\"done\":true,\"host\":\"localhost\","
        + "\"index\":\"main\",\"source\":\"Splunk\",\"sourcetype\":\"misc\","
        + "\"stanza\":\"test_scheme://test\",\"time\":1372274622.493,\"unbroken\":true}",
        writer.toJson(event));
  }

  @Test
  void writesAbsentMetadataAsNull() {
    Event event = Event.builder().data("line\n☃").time("5").build();

    assertEquals("{\"data\":\"line\\n☃\",\"done\":false,\"host\":null,\"index\":null,\"source\":null,"
        + "\"sourcetype\":null,\"stanza\":null,\"time\":5,\"unbroken\":false}", writer.toJson(event));
  }

  @Test
  void rejectsNullEvent() {
    assertThrows(NullPointerException.class, () -> writer.toJson(null));
  }
}
