/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.model;

import com.google.gson.annotations.JsonAdapter;
import com.google.gson.annotations.SerializedName;
import io.wisetime.toggl.json.ExplicitNullTimestampAdapter;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Payload that turns a stopped time entry back into a running one, keeping its id and start time.
 * The stop time is always sent as {@code null} so that Toggl clears it.
 */
@Getter
@Setter
@ToString
@Accessors(chain = true)
public class TimeEntryReopenRequest {

  @SerializedName(value = "workspace_id")
  private long workspaceId;

  @SerializedName(value = "description")
  private String description;

  @SerializedName(value = "project_id")
  private Long projectId;

  @SerializedName(value = "task_id")
  private Long taskId;

  @SerializedName(value = "tags")
  private List<String> tags = new ArrayList<>();

  @SerializedName(value = "billable")
  private boolean billable;

  @SerializedName(value = "start")
  private OffsetDateTime start;

  @Setter(AccessLevel.NONE)
  @JsonAdapter(value = ExplicitNullTimestampAdapter.class, nullSafe = false)
  @SerializedName(value = "stop")
  private OffsetDateTime stop;

  @Setter(AccessLevel.NONE)
  @SerializedName(value = "duration")
  private long duration = -1;

  public static TimeEntryReopenRequest of(TimeEntry timeEntry) {
    return new TimeEntryReopenRequest()
        .setWorkspaceId(timeEntry.getWorkspaceId())
        .setDescription(timeEntry.getDescription())
        .setProjectId(timeEntry.getProjectId())
        .setTaskId(timeEntry.getTaskId())
        .setTags(new ArrayList<>(timeEntry.getTags()))
        .setBillable(timeEntry.isBillable())
        .setStart(timeEntry.getStart());
  }
}
