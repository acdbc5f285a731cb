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
public class Tag {
  @SerializedName(value = "workspace_id", alternate = {"wid"})
  private long workspaceId;

  @SerializedName(value = "id")
  private long id;

  @SerializedName(value = "name")
  private String name;
}
