/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl;

import com.google.gson.Gson;
import io.wisetime.toggl.json.DecodingConverterFactory;
import io.wisetime.toggl.json.TogglGson;
import io.wisetime.toggl.model.Account;
import io.wisetime.toggl.util.TogglDecodeException;
import javax.inject.Inject;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Converter;
import retrofit2.Retrofit;

/**
 * Creates {@link TogglSession}s, either from an existing API token or by logging in with a username and password.
 *
 * <p>All sessions of one factory share its HTTP connection pool and its {@link DiagnosticLog}.
 *
 * @author pascal
 */
public class TogglSessionFactory {

  private static final Logger log = LoggerFactory.getLogger(TogglSessionFactory.class);

  private final TogglConfig config;
  private final OkHttpClient httpClient;
  private final Gson gson;
  private final DiagnosticLog diagnosticLog;

  public TogglSessionFactory(TogglConfig config) {
    this(config, new OkHttpClient(), TogglGson.create());
  }

  @Inject
  public TogglSessionFactory(TogglConfig config, OkHttpClient httpClient, Gson gson) {
    this.config = config;
    this.httpClient = httpClient;
    this.gson = gson;
    this.diagnosticLog = new DiagnosticLog(config.isDiagnosticLogging());
  }

  /**
   * Opens a session for an existing API token. No request is made.
   */
  public TogglSession open(String apiToken) {
    return create(TogglCredentials.ofApiToken(apiToken));
  }

  /**
   * Logs in with a username and password to discover the user's API token, and returns a session using that token.
   * The password is not kept.
   */
  public TogglSession login(String username, String password) {
    Account account = create(TogglCredentials.ofLogin(username, password)).fetchAccount(false);
    if (account.getApiToken() == null || account.getApiToken().isEmpty()) {
      throw new TogglDecodeException("Toggl login response for " + username + " did not contain an API token");
    }
    log.info("Logged in to Toggl as user {}", account.getId());
    return open(account.getApiToken());
  }

  public DiagnosticLog getDiagnosticLog() {
    return diagnosticLog;
  }

  public TogglConfig getConfig() {
    return config;
  }

  TogglSession create(TogglCredentials credentials) {
    // sessions get their own interceptors but share the connection pool of the base client
    OkHttpClient sessionClient = httpClient.newBuilder()
        .addInterceptor(new BasicAuthInterceptor(credentials))
        .addInterceptor(diagnosticLog.httpInterceptor())
        .build();
    Converter.Factory converterFactory = DecodingConverterFactory.create(gson, diagnosticLog::isEnabled);

    return new TogglSession(
        credentials,
        config,
        diagnosticLog,
        retrofit(sessionClient, config.getApiBaseUrl(), converterFactory).create(TogglSession.TogglApi.class),
        retrofit(sessionClient, config.getReportsBaseUrl(), converterFactory).create(TogglSession.TogglReportsApi.class));
  }

  private static Retrofit retrofit(OkHttpClient client, String baseUrl, Converter.Factory converterFactory) {
    return new Retrofit.Builder()
        .client(client)
        .baseUrl(TogglConfig.withTrailingSlash(baseUrl))
        .addConverterFactory(converterFactory)
        .build();
  }
}
