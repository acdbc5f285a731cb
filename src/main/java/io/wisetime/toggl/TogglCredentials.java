/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl;

import com.google.common.base.Preconditions;
import okhttp3.Credentials;

/**
 * HTTP basic credentials of a session: either an API token, or a username and password pair.
 */
public final class TogglCredentials {

  static final String API_TOKEN_PASSWORD = "api_token";

  private final String username;
  private final String password;
  private final boolean apiToken;

  private TogglCredentials(String username, String password, boolean apiToken) {
    this.username = username;
    this.password = password;
    this.apiToken = apiToken;
  }

  public static TogglCredentials ofApiToken(String apiToken) {
    Preconditions.checkArgument(apiToken != null && !apiToken.isEmpty(), "API token must not be empty");
    return new TogglCredentials(apiToken, API_TOKEN_PASSWORD, true);
  }

  public static TogglCredentials ofLogin(String username, String password) {
    Preconditions.checkArgument(username != null && !username.isEmpty(), "Username must not be empty");
    Preconditions.checkNotNull(password, "Password must not be null");
    return new TogglCredentials(username, password, false);
  }

  public boolean isApiToken() {
    return apiToken;
  }

  String toAuthorizationHeader() {
    return Credentials.basic(username, password);
  }

  @Override
  public String toString() {
    return apiToken ? "TogglCredentials{apiToken=****}" : "TogglCredentials{username=" + username + "}";
  }
}
