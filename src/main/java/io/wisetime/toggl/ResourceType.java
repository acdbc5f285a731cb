/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl;

/**
 * Workspace scoped resources of the Toggl API.
 */
public enum ResourceType {

  CLIENTS("clients"),
  PROJECTS("projects"),
  TAGS("tags"),
  TIME_ENTRIES("time_entries");

  private final String pathSegment;

  ResourceType(final String pathSegment) {
    this.pathSegment = pathSegment;
  }

  public String getPathSegment() {
    return pathSegment;
  }

  @Override
  public String toString() {
    return pathSegment;
  }
}
