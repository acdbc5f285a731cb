/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.json;

import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import io.wisetime.toggl.model.RawTimeEntry;
import io.wisetime.toggl.model.TimeEntry;
import java.lang.reflect.Type;

/**
 * Decodes time entries in two steps: everything but the timestamps straight from the payload, then the raw start
 * and stop strings through {@link Timestamps#parse}.
 */
class TimeEntryDeserializer implements JsonDeserializer<TimeEntry> {

  @Override
  public TimeEntry deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context)
      throws JsonParseException {
    if (json.isJsonNull()) {
      return null;
    }
    if (!json.isJsonObject()) {
      throw new JsonParseException("Expected a time entry object but got: " + json);
    }
    RawTimeEntry raw = context.deserialize(json, RawTimeEntry.class);
    return raw.toTimeEntry(Timestamps::parse);
  }
}
