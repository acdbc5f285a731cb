/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.json;

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.time.OffsetDateTime;

/**
 * Gson adapter for timestamps outside of time entries, such as project deletion dates and report rows.
 */
class OffsetDateTimeAdapter extends TypeAdapter<OffsetDateTime> {

  @Override
  public void write(JsonWriter out, OffsetDateTime value) throws IOException {
    if (value == null) {
      out.nullValue();
      return;
    }
    out.value(Timestamps.format(value));
  }

  @Override
  public OffsetDateTime read(JsonReader in) throws IOException {
    if (in.peek() == JsonToken.NULL) {
      in.nextNull();
      return null;
    }
    String value = in.nextString();
    return value.isEmpty() ? null : Timestamps.parse(value);
  }
}
