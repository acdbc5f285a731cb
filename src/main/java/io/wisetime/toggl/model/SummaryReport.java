/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.model;

import com.google.gson.annotations.SerializedName;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Summary report returned by the Toggl reports API, grouped by project.
 */
@Getter
@Setter
@ToString
@Accessors(chain = true)
public class SummaryReport {
  @SerializedName(value = "total_grand")
  private long totalGrand;

  @SerializedName(value = "data")
  private List<ProjectSummary> data = new ArrayList<>();

  @Getter
  @Setter
  @ToString
  @Accessors(chain = true)
  public static class ProjectSummary {
    @SerializedName(value = "id")
    private Long id;

    @SerializedName(value = "time")
    private long time;

    @SerializedName(value = "title")
    private Title title;

    @SerializedName(value = "items")
    private List<Item> items = new ArrayList<>();
  }

  @Getter
  @Setter
  @ToString
  @Accessors(chain = true)
  public static class Title {
    @SerializedName(value = "project")
    private String project;

    @SerializedName(value = "client")
    private String client;

    @SerializedName(value = "color")
    private String color;

    @SerializedName(value = "hex_color")
    private String hexColor;
  }

  @Getter
  @Setter
  @ToString
  @Accessors(chain = true)
  public static class Item {
    @SerializedName(value = "title")
    private Map<String, String> title;

    @SerializedName(value = "time")
    private long time;
  }
}
