/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.model;

import com.google.gson.annotations.SerializedName;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * The authenticated user, optionally with all of its related entities embedded.
 */
@Getter
@Setter
@ToString
@Accessors(chain = true)
public class Account {
  @ToString.Exclude
  @SerializedName(value = "api_token")
  private String apiToken;

  @SerializedName(value = "timezone")
  private String timezone;

  @SerializedName(value = "id")
  private long id;

  @SerializedName(value = "workspaces")
  private List<Workspace> workspaces = new ArrayList<>();

  @SerializedName(value = "clients")
  private List<Client> clients = new ArrayList<>();

  @SerializedName(value = "projects")
  private List<Project> projects = new ArrayList<>();

  @SerializedName(value = "tasks")
  private List<Task> tasks = new ArrayList<>();

  @SerializedName(value = "tags")
  private List<Tag> tags = new ArrayList<>();

  @SerializedName(value = "time_entries")
  private List<TimeEntry> timeEntries = new ArrayList<>();

  @SerializedName(value = "beginning_of_week")
  private int beginningOfWeek;
}
