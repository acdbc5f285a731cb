/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Adds the session credentials and the JSON content type to every request.
 */
class BasicAuthInterceptor implements Interceptor {

  private final TogglCredentials credentials;

  BasicAuthInterceptor(TogglCredentials credentials) {
    this.credentials = credentials;
  }

  @Override
  public Response intercept(Chain chain) throws IOException {
    Request newRequest = chain.request().newBuilder()
        .header("Authorization", credentials.toAuthorizationHeader())
        .header("Content-Type", "application/json")
        .build();
    return chain.proceed(newRequest);
  }
}
