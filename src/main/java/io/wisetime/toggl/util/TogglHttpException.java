/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.util;

import lombok.Getter;

/**
 * Toggl answered with a status code outside of [200, 400).
 *
 * <p>The raw response body is kept as is so that callers can inspect the error payload. It is never decoded by the
 * client.
 */
@Getter
public class TogglHttpException extends TogglException {

  private final int statusCode;
  private final String statusLine;
  private final String body;

  public TogglHttpException(int statusCode, String statusLine, String body) {
    super("Toggl request failed with HTTP " + statusLine);
    this.statusCode = statusCode;
    this.statusLine = statusLine;
    this.body = body;
  }
}
