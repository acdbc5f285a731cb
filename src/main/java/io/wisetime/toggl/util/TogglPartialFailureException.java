/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.util;

import io.wisetime.toggl.model.TimeEntry;
import lombok.Getter;

/**
 * A compound operation created its new time entry but failed to clean up the old one.
 * The new entry is available through {@link #getNewEntry()}, the cleanup failure is the cause.
 */
@Getter
public class TogglPartialFailureException extends TogglException {

  private final TimeEntry newEntry;

  public TogglPartialFailureException(String message, TimeEntry newEntry, TogglException cause) {
    super(message + ": " + cause.getMessage(), cause);
    this.newEntry = newEntry;
  }
}
