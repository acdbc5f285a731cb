/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl;

import java.util.Optional;

/**
 * Configuration keys for the Toggl client. Looked up in system properties first, then in the environment.
 *
 * @author pascal
 */
public enum TogglConfigKey {

  //optional
  TOGGL_API_URL("TOGGL_API_URL"),
  TOGGL_REPORTS_URL("TOGGL_REPORTS_URL"),
  TOGGL_APP_NAME("TOGGL_APP_NAME"),
  TOGGL_USER_AGENT("TOGGL_USER_AGENT"),
  TOGGL_DIAGNOSTIC_LOGGING("TOGGL_DIAGNOSTIC_LOGGING");

  private final String configKey;

  TogglConfigKey(final String configKey) {
    this.configKey = configKey;
  }

  public String getConfigKey() {
    return configKey;
  }

  public Optional<String> getString() {
    String value = System.getProperty(configKey, System.getenv(configKey));
    return Optional.ofNullable(value).map(String::trim).filter(v -> !v.isEmpty());
  }

  public Optional<Boolean> getBoolean() {
    return getString().map(Boolean::parseBoolean);
  }
}
