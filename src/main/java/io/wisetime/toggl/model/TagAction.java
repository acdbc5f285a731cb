/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.model;

/**
 * How the tags sent with a time entry update are applied.
 */
public enum TagAction {
  ADD("add"),
  REMOVE("remove");

  private final String value;

  TagAction(final String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
