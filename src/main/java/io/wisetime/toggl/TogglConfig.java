/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl;

import java.time.Clock;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Settings shared by all sessions created from one {@link TogglSessionFactory}.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class TogglConfig {

  public static final String DEFAULT_API_URL = "https://api.track.toggl.com/api/v9/";
  public static final String DEFAULT_REPORTS_URL = "https://api.track.toggl.com/reports/api/v2/";
  public static final String DEFAULT_APP_NAME = "wisetime-toggl-client";

  @Builder.Default
  private final String apiBaseUrl = DEFAULT_API_URL;

  @Builder.Default
  private final String reportsBaseUrl = DEFAULT_REPORTS_URL;

  /**
   * Sent as {@code created_with} on every time entry created by the client.
   */
  @Builder.Default
  private final String appName = DEFAULT_APP_NAME;

  /**
   * Sent as {@code user_agent} to the reports API.
   */
  @Builder.Default
  private final String userAgent = DEFAULT_APP_NAME;

  /**
   * Initial state of the {@link DiagnosticLog}.
   */
  @Builder.Default
  private final boolean diagnosticLogging = false;

  /**
   * Source of "now" for new timers and of today's date when continuing one.
   */
  @Builder.Default
  private final Clock clock = Clock.systemDefaultZone();

  public static TogglConfig defaults() {
    return TogglConfig.builder().build();
  }

  public static TogglConfig fromEnvironment() {
    TogglConfigBuilder builder = TogglConfig.builder();
    TogglConfigKey.TOGGL_API_URL.getString().map(TogglConfig::withTrailingSlash).ifPresent(builder::apiBaseUrl);
    TogglConfigKey.TOGGL_REPORTS_URL.getString().map(TogglConfig::withTrailingSlash).ifPresent(builder::reportsBaseUrl);
    TogglConfigKey.TOGGL_APP_NAME.getString().ifPresent(builder::appName);
    TogglConfigKey.TOGGL_USER_AGENT.getString().ifPresent(builder::userAgent);
    TogglConfigKey.TOGGL_DIAGNOSTIC_LOGGING.getBoolean().ifPresent(builder::diagnosticLogging);
    return builder.build();
  }

  // Retrofit resolves relative paths against the last slash of the base url
  static String withTrailingSlash(String url) {
    return url.endsWith("/") ? url : url + "/";
  }
}
