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

@Getter
@Setter
@ToString
@Accessors(chain = true)
public class DetailedTimeEntry {
  @SerializedName(value = "id")
  private long id;

  @SerializedName(value = "pid")
  private Long projectId;

  @SerializedName(value = "tid")
  private Long taskId;

  @SerializedName(value = "uid")
  private long userId;

  @SerializedName(value = "user")
  private String user;

  @SerializedName(value = "description")
  private String description;

  @SerializedName(value = "project")
  private String project;

  @SerializedName(value = "project_color")
  private String projectColor;

  @SerializedName(value = "project_hex_color")
  private String projectHexColor;

  @SerializedName(value = "client")
  private String client;

  @SerializedName(value = "start")
  private OffsetDateTime start;

  @SerializedName(value = "end")
  private OffsetDateTime end;

  @SerializedName(value = "updated")
  private OffsetDateTime updated;

  // milliseconds
  @SerializedName(value = "dur")
  private long duration;

  @SerializedName(value = "billable")
  private boolean billable;

  @SerializedName(value = "tags")
  private List<String> tags = new ArrayList<>();
}
