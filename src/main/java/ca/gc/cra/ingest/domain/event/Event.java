package ca.gc.cra.ingest.domain.event;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * <strong>What:</strong> Immutable unit of collected data plus routing metadata and fragment flags.
 * <p><strong>Why:</strong> Both wire formatters read the same record so field identity and ordering stay
 * consistent regardless of which ingestion format a caller targets.</p>
 * <p><strong>Thread-safety:</strong> Records are immutable and safe to share across threads.</p>
 *
 * @param data raw payload text; never {@code null}, may be empty or contain control characters
 * @param time epoch seconds with the fractional precision supplied by the caller; never {@code null}
 * @param index destination index; {@code null} when absent
 * @param host originating host; {@code null} when absent
 * @param source event source; {@code null} when absent
 * @param sourcetype event source type; {@code null} when absent
 * @param stanza input configuration that produced the event; {@code null} when absent
 * @param unbroken {@code true} when the event is a fragment of a larger logical event
 * @param done {@code true} when the event is the terminal fragment of a broken event
 *
 * @since 0.1.0
 */
public record Event(
    String data,
    BigDecimal time,
    String index,
    String host,
    String source,
    String sourcetype,
    String stanza,
    boolean unbroken,
    boolean done) {

  /**
   * Validates required fields and normalizes blank optional metadata to {@code null}.
   *
   * @throws EventConstructionException when {@code data} or {@code time} is missing
   */
  public Event {
    if (data == null) {
      throw new EventConstructionException("data is required");
    }
    if (time == null) {
      throw new EventConstructionException("time is required");
    }
    index = blankToNull(index);
    host = blankToNull(host);
    source = blankToNull(source);
    sourcetype = blankToNull(sourcetype);
    stanza = blankToNull(stanza);
  }

  /**
   * Starts a builder; {@link Builder#data(String)} and one of the {@code time} setters are mandatory.
   *
   * @return new mutable builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder pre-populated with this event's values.
   *
   * @return builder seeded from this record
   */
  public Builder toBuilder() {
    return new Builder()
        .data(data)
        .time(time)
        .index(index)
        .host(host)
        .source(source)
        .sourcetype(sourcetype)
        .stanza(stanza)
        .unbroken(unbroken)
        .done(done);
  }

  private static String blankToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }

  /**
   * Mutable builder for {@link Event}. Not thread-safe.
   */
  public static final class Builder {
    private String data;
    private BigDecimal time;
    private String index;
    private String host;
    private String source;
    private String sourcetype;
    private String stanza;
    private boolean unbroken;
    private boolean done;

    private Builder() {}

    public Builder data(String data) {
      this.data = data;
      return this;
    }

    public Builder time(BigDecimal time) {
      this.time = time;
      return this;
    }

    /**
     * Sets the timestamp from a double using its shortest decimal representation, so
     * {@code 1372274622.493} is kept as {@code 1372274622.493} rather than the nearest binary value.
     *
     * @param epochSeconds fractional epoch seconds
     * @return this builder
     * @throws EventConstructionException when the value is NaN or infinite
     */
    public Builder time(double epochSeconds) {
      if (Double.isNaN(epochSeconds) || Double.isInfinite(epochSeconds)) {
        throw new EventConstructionException("time must be finite (was " + epochSeconds + ")");
      }
      this.time = BigDecimal.valueOf(epochSeconds);
      return this;
    }

    /**
     * Sets the timestamp from decimal text such as {@code "1372274622.493"}.
     *
     * @param epochSeconds decimal epoch seconds
     * @return this builder
     * @throws EventConstructionException when the text is not a decimal number
     */
    public Builder time(String epochSeconds) {
      if (epochSeconds == null) {
        this.time = null;
        return this;
      }
      try {
        this.time = new BigDecimal(epochSeconds.trim());
      } catch (NumberFormatException ex) {
        throw new EventConstructionException("time is not a decimal number: " + epochSeconds, ex);
      }
      return this;
    }

    /**
     * Sets the timestamp from an instant, keeping nanosecond precision without trailing zeros.
     *
     * @param instant capture instant; {@code null} clears the timestamp
     * @return this builder
     */
    public Builder time(Instant instant) {
      if (instant == null) {
        this.time = null;
        return this;
      }
      BigDecimal seconds = BigDecimal.valueOf(instant.getEpochSecond());
      if (instant.getNano() == 0) {
        this.time = seconds;
      } else {
        this.time = seconds.add(BigDecimal.valueOf(instant.getNano(), 9)).stripTrailingZeros();
      }
      return this;
    }

    public Builder index(String index) {
      this.index = index;
      return this;
    }

    public Builder host(String host) {
      this.host = host;
      return this;
    }

    public Builder source(String source) {
      this.source = source;
      return this;
    }

    public Builder sourcetype(String sourcetype) {
      this.sourcetype = sourcetype;
      return this;
    }

    public Builder stanza(String stanza) {
      this.stanza = stanza;
      return this;
    }

    public Builder unbroken(boolean unbroken) {
      this.unbroken = unbroken;
      return this;
    }

    public Builder done(boolean done) {
      this.done = done;
      return this;
    }

    /**
     * Builds the immutable event.
     *
     * @return validated event
     * @throws EventConstructionException when {@code data} or {@code time} was never supplied
     */
    public Event build() {
      return new Event(data, time, index, host, source, sourcetype, stanza, unbroken, done);
    }
  }
}
