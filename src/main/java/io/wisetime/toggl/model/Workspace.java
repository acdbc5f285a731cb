/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.model;

import com.google.gson.annotations.SerializedName;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

@Getter
@Setter
@ToString
@Accessors(chain = true)
public class Workspace {
  @SerializedName(value = "id")
  private long id;

  @SerializedName(value = "rounding_minutes")
  private int roundingMinutes;

  @SerializedName(value = "rounding")
  private int rounding;

  @SerializedName(value = "name")
  private String name;

  @SerializedName(value = "premium")
  private boolean premium;
}
