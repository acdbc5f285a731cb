/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.wisetime.toggl.model.TimeEntry;
import java.time.OffsetDateTime;

/**
 * Builds the {@link Gson} instance used for every request and response body.
 */
public final class TogglGson {

  private TogglGson() {
  }

  public static Gson create() {
    return builder().create();
  }

  public static GsonBuilder builder() {
    return new GsonBuilder()
        .registerTypeAdapter(OffsetDateTime.class, new OffsetDateTimeAdapter())
        .registerTypeAdapter(TimeEntry.class, new TimeEntryDeserializer());
  }
}
