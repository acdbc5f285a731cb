/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.model;

import com.google.gson.annotations.SerializedName;
import java.time.OffsetDateTime;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

@Getter
@Setter
@ToString
@Accessors(chain = true)
public class Project {
  @SerializedName(value = "workspace_id", alternate = {"wid"})
  private long workspaceId;

  @SerializedName(value = "id")
  private long id;

  @SerializedName(value = "client_id", alternate = {"cid"})
  private Long clientId;

  @SerializedName(value = "name")
  private String name;

  @Getter(AccessLevel.NONE)
  @SerializedName(value = "active")
  private boolean active;

  @SerializedName(value = "billable")
  private Boolean billable;

  @SerializedName(value = "server_deleted_at")
  private OffsetDateTime serverDeletedAt;

  /**
   * Whether the project exists and is active. A project deleted on the server is never active, whatever its
   * active flag says.
   */
  public boolean isActive() {
    return active && serverDeletedAt == null;
  }

  /**
   * The raw active flag as reported by Toggl.
   */
  public boolean isMarkedActive() {
    return active;
  }
}
