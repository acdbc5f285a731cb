/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.model;

import com.google.gson.annotations.SerializedName;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Payload used to create a time entry.
 */
@Getter
@Setter
@ToString
@Accessors(chain = true)
public class TimeEntryRequest {
  @SerializedName(value = "billable")
  private boolean billable;

  @SerializedName(value = "description")
  private String description;

  // -1 for a running entry
  @SerializedName(value = "duration")
  private long duration;

  @SerializedName(value = "project_id")
  private Long projectId;

  @SerializedName(value = "task_id")
  private Long taskId;

  @SerializedName(value = "start")
  private OffsetDateTime start;

  @SerializedName(value = "stop")
  private OffsetDateTime stop;

  @SerializedName(value = "tags")
  private List<String> tags = new ArrayList<>();

  @SerializedName(value = "workspace_id")
  private long workspaceId;

  @SerializedName(value = "created_with")
  private String createdWith;

  public TimeEntryRequest copy() {
    return new TimeEntryRequest()
        .setBillable(billable)
        .setDescription(description)
        .setDuration(duration)
        .setProjectId(projectId)
        .setTaskId(taskId)
        .setStart(start)
        .setStop(stop)
        .setTags(tags == null ? new ArrayList<>() : new ArrayList<>(tags))
        .setWorkspaceId(workspaceId)
        .setCreatedWith(createdWith);
  }

  /**
   * Copies project, task, tags and billable flag from an existing entry.
   */
  public TimeEntryRequest withMetadataFrom(TimeEntry timeEntry) {
    return setProjectId(timeEntry.getProjectId())
        .setTaskId(timeEntry.getTaskId())
        .setTags(new ArrayList<>(timeEntry.getTags()))
        .setBillable(timeEntry.isBillable());
  }
}
