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
 * One page of a detailed report returned by the Toggl reports API.
 */
@Getter
@Setter
@ToString
@Accessors(chain = true)
public class DetailedReport {
  @SerializedName(value = "total_grand")
  private long totalGrand;

  @SerializedName(value = "total_count")
  private int totalCount;

  @SerializedName(value = "per_page")
  private int perPage;

  @SerializedName(value = "data")
  private List<DetailedTimeEntry> data = new ArrayList<>();
}
