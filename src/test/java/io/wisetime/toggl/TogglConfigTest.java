/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TogglConfigTest {

  @AfterEach
  void clearProperties() {
    for (TogglConfigKey key : TogglConfigKey.values()) {
      System.clearProperty(key.getConfigKey());
    }
  }

  @Test
  void defaults() {
    TogglConfig config = TogglConfig.defaults();

    assertThat(config.getApiBaseUrl()).isEqualTo("https://api.track.toggl.com/api/v9/");
    assertThat(config.getReportsBaseUrl()).isEqualTo("https://api.track.toggl.com/reports/api/v2/");
    assertThat(config.getAppName()).isEqualTo(TogglConfig.DEFAULT_APP_NAME);
    assertThat(config.getUserAgent()).isEqualTo(TogglConfig.DEFAULT_APP_NAME);
    assertThat(config.isDiagnosticLogging()).isFalse();
    assertThat(config.getClock()).isNotNull();
  }

  @Test
  void fromEnvironment_readsSystemProperties() {
    System.setProperty(TogglConfigKey.TOGGL_API_URL.getConfigKey(), "http://localhost:8080/api/v9");
    System.setProperty(TogglConfigKey.TOGGL_APP_NAME.getConfigKey(), " timesheet-sync ");
    System.setProperty(TogglConfigKey.TOGGL_DIAGNOSTIC_LOGGING.getConfigKey(), "true");

    TogglConfig config = TogglConfig.fromEnvironment();

    assertThat(config.getApiBaseUrl()).isEqualTo("http://localhost:8080/api/v9/");
    assertThat(config.getAppName()).isEqualTo("timesheet-sync");
    assertThat(config.isDiagnosticLogging()).isTrue();
    assertThat(config.getReportsBaseUrl())
        .as("keys which are not set keep their default")
        .isEqualTo(TogglConfig.DEFAULT_REPORTS_URL);
  }

  @Test
  void fromEnvironment_ignoresBlankValues() {
    System.setProperty(TogglConfigKey.TOGGL_USER_AGENT.getConfigKey(), "   ");

    assertThat(TogglConfigKey.TOGGL_USER_AGENT.getString()).isEmpty();
    assertThat(TogglConfig.fromEnvironment().getUserAgent()).isEqualTo(TogglConfig.DEFAULT_APP_NAME);
  }

  @Test
  void withTrailingSlash() {
    assertThat(TogglConfig.withTrailingSlash("https://example.com/api")).isEqualTo("https://example.com/api/");
    assertThat(TogglConfig.withTrailingSlash("https://example.com/api/")).isEqualTo("https://example.com/api/");
  }
}
