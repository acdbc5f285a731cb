/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.util;

import java.io.IOException;

/**
 * The request never produced an HTTP response: connection refused, timeout, DNS failure and the like.
 */
public class TogglTransportException extends TogglException {

  public TogglTransportException(String message, IOException cause) {
    super(message, cause);
  }

  @Override
  public synchronized IOException getCause() {
    return (IOException) super.getCause();
  }
}
