/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.model;

import com.google.gson.annotations.SerializedName;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Permissive shape of a time entry as sent by Toggl. Timestamps are kept as the raw strings found in the payload,
 * since Toggl has used more than one format for them over time.
 */
public class RawTimeEntry {
  @SerializedName(value = "workspace_id", alternate = {"wid"})
  private long workspaceId;

  @SerializedName(value = "id")
  private long id;

  @SerializedName(value = "project_id", alternate = {"pid"})
  private Long projectId;

  @SerializedName(value = "task_id", alternate = {"tid"})
  private Long taskId;

  @SerializedName(value = "description")
  private String description;

  @SerializedName(value = "start")
  private String start;

  @SerializedName(value = "stop")
  private String stop;

  @SerializedName(value = "tags")
  private List<String> tags;

  @SerializedName(value = "duration")
  private long duration;

  @SerializedName(value = "duronly")
  private boolean durationOnly;

  @SerializedName(value = "billable")
  private boolean billable;

  /**
   * Converts into the strict {@link TimeEntry}. Empty or missing timestamps become {@code null}.
   *
   * @param timestampParser parses a non-empty timestamp string, failing on unknown formats
   */
  public TimeEntry toTimeEntry(Function<String, OffsetDateTime> timestampParser) {
    return new TimeEntry()
        .setWorkspaceId(workspaceId)
        .setId(id)
        .setProjectId(projectId)
        .setTaskId(taskId)
        .setDescription(description)
        .setTags(tags == null ? new ArrayList<>() : new ArrayList<>(tags))
        .setDurationOnly(durationOnly)
        .setBillable(billable)
        .restore(parse(start, timestampParser), parse(stop, timestampParser), duration);
  }

  private static OffsetDateTime parse(String value, Function<String, OffsetDateTime> timestampParser) {
    if (value == null || value.isEmpty()) {
      return null;
    }
    return timestampParser.apply(value);
  }
}
