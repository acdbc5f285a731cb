/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.model;

import com.google.common.base.Preconditions;
import com.google.gson.annotations.SerializedName;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * A single Toggl time entry.
 *
 * <p>An entry is running if and only if its duration is negative. The presence of a stop time says nothing about
 * the running state. Start, stop and duration are kept consistent with each other, which is why they can only be
 * changed through {@link #setStartTime}, {@link #setStopTime}, {@link #setDuration} and {@link #markRunning}.
 *
 * @author pascal
 */
@Getter
@Setter
@Accessors(chain = true)
public class TimeEntry {
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

  @Setter(AccessLevel.NONE)
  @SerializedName(value = "start")
  private OffsetDateTime start;

  @Setter(AccessLevel.NONE)
  @SerializedName(value = "stop")
  private OffsetDateTime stop;

  @SerializedName(value = "tags")
  private List<String> tags = new ArrayList<>();

  @Setter(AccessLevel.NONE)
  @SerializedName(value = "duration")
  private long duration;

  @SerializedName(value = "duronly")
  private boolean durationOnly;

  @SerializedName(value = "billable")
  private boolean billable;

  public boolean isRunning() {
    return duration < 0;
  }

  /**
   * Replaces the tags. A {@code null} list clears them.
   */
  public TimeEntry setTags(List<String> tags) {
    this.tags = tags == null ? new ArrayList<>() : tags;
    return this;
  }

  public boolean hasTag(String tag) {
    return tags.contains(tag);
  }

  /**
   * Appends the tag unless the entry already carries it.
   */
  public TimeEntry addTag(String tag) {
    if (!hasTag(tag)) {
      tags.add(tag);
    }
    return this;
  }

  /**
   * Removes the first occurrence of the tag, keeping the order of the remaining tags.
   */
  public TimeEntry removeTag(String tag) {
    tags.remove(tag);
    return this;
  }

  /**
   * Sets the duration in seconds and moves the stop time accordingly.
   *
   * @throws IllegalStateException if the entry is running or has no start time
   */
  public TimeEntry setDuration(long durationSecs) {
    checkStopped();
    Preconditions.checkState(start != null, "TimeEntry has no start time");
    this.duration = durationSecs;
    this.stop = start.plusSeconds(durationSecs);
    return this;
  }

  /**
   * Sets the start time. If the entry is stopped, either the stop time is moved to keep the duration
   * ({@code updateEnd}) or the duration is recomputed from the existing stop time.
   *
   * @throws IllegalStateException if the duration has to be recomputed but the entry has no stop time
   */
  public TimeEntry setStartTime(OffsetDateTime newStart, boolean updateEnd) {
    if (!isRunning()) {
      if (updateEnd) {
        this.stop = newStart.plusSeconds(duration);
      } else {
        Preconditions.checkState(stop != null, "TimeEntry has no stop time");
        this.duration = ChronoUnit.SECONDS.between(newStart, stop);
      }
    }
    this.start = newStart;
    return this;
  }

  /**
   * Sets the stop time and recomputes the duration in whole seconds.
   *
   * @throws IllegalStateException if the entry is running or has no start time
   */
  public TimeEntry setStopTime(OffsetDateTime newStop) {
    checkStopped();
    Preconditions.checkState(start != null, "TimeEntry has no start time");
    this.duration = ChronoUnit.SECONDS.between(start, newStop);
    this.stop = newStop;
    return this;
  }

  /**
   * Turns the entry into a running one started at the given time. The stop time is cleared.
   */
  public TimeEntry markRunning(OffsetDateTime runningSince) {
    this.start = runningSince;
    this.stop = null;
    this.duration = -1;
    return this;
  }

  /**
   * Returns an independent copy. Changing the tags, start or stop of the copy never affects this entry.
   */
  public TimeEntry copy() {
    return new TimeEntry()
        .setWorkspaceId(workspaceId)
        .setId(id)
        .setProjectId(projectId)
        .setTaskId(taskId)
        .setDescription(description)
        .setTags(new ArrayList<>(tags))
        .setDurationOnly(durationOnly)
        .setBillable(billable)
        .restore(start, stop, duration);
  }

  TimeEntry restore(OffsetDateTime start, OffsetDateTime stop, long duration) {
    this.start = start;
    this.stop = stop;
    this.duration = duration;
    return this;
  }

  private void checkStopped() {
    Preconditions.checkState(!isRunning(), "TimeEntry must be stopped");
  }

  @Override
  public String toString() {
    return "TimeEntry{id=" + id + ", workspaceId=" + workspaceId + ", description='" + description + "'"
        + ", start=" + start + ", stop=" + stop + ", duration=" + duration + ", tags=" + tags + "}";
  }
}
