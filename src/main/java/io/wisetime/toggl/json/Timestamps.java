/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.json;

import io.wisetime.toggl.util.TogglDecodeException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

/**
 * Parses and formats the timestamps exchanged with Toggl.
 *
 * <p>Toggl has changed its timestamp serialization between API versions and both forms can show up in the same
 * response: UTC with a trailing {@code Z}, and an explicit numeric offset. Fractional seconds are accepted in
 * both forms.
 *
 * @author pascal
 */
public final class Timestamps {

  private static final DateTimeFormatter UTC_FORMAT = new DateTimeFormatterBuilder()
      .appendPattern("yyyy-MM-dd'T'HH:mm:ss")
      .optionalStart()
      .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
      .optionalEnd()
      .appendLiteral('Z')
      .toFormatter();

  private static final DateTimeFormatter OFFSET_FORMAT = new DateTimeFormatterBuilder()
      .appendPattern("yyyy-MM-dd'T'HH:mm:ss")
      .optionalStart()
      .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
      .optionalEnd()
      .appendOffset("+HH:MM", "+00:00")
      .toFormatter();

  private Timestamps() {
  }

  /**
   * Parses a timestamp in either accepted format.
   *
   * @throws TogglDecodeException naming the input if it matches neither format
   */
  public static OffsetDateTime parse(String value) {
    try {
      return LocalDateTime.parse(value, UTC_FORMAT).atOffset(ZoneOffset.UTC);
    } catch (DateTimeParseException utcFailure) {
      try {
        return OffsetDateTime.parse(value, OFFSET_FORMAT);
      } catch (DateTimeParseException offsetFailure) {
        throw new TogglDecodeException("Unable to parse timestamp '" + value + "'", offsetFailure);
      }
    }
  }

  /**
   * Formats as ISO-8601 with offset, which {@link #parse} reads back to the same instant.
   */
  public static String format(OffsetDateTime value) {
    return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(value);
  }
}
