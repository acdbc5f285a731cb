/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.util;

/**
 * General error raised by the Toggl client. Carries a message that can be shown to a user.
 *
 * @author pascal
 */
public class TogglException extends RuntimeException {

  public TogglException(String message) {
    super(message);
  }

  public TogglException(String message, Throwable cause) {
    super(message, cause);
  }
}
