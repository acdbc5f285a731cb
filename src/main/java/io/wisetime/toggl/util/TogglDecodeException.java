/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.util;

/**
 * A response payload did not match the expected shape, or one of its timestamps could not be parsed.
 */
public class TogglDecodeException extends TogglException {

  public TogglDecodeException(String message) {
    super(message);
  }

  public TogglDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
