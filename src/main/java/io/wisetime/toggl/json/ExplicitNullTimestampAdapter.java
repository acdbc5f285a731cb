/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.json;

import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.time.OffsetDateTime;

/**
 * Timestamp adapter that writes a missing value as an explicit JSON {@code null}, even when the {@link JsonWriter}
 * drops null fields. Used on fields whose absence would leave the server side value untouched.
 */
public class ExplicitNullTimestampAdapter extends OffsetDateTimeAdapter {

  @Override
  public void write(JsonWriter out, OffsetDateTime value) throws IOException {
    if (value != null) {
      super.write(out, value);
      return;
    }
    boolean serializeNulls = out.getSerializeNulls();
    out.setSerializeNulls(true);
    try {
      out.nullValue();
    } finally {
      out.setSerializeNulls(serializeNulls);
    }
  }
}
