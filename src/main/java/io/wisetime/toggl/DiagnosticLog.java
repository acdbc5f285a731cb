/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl;

import okhttp3.logging.HttpLoggingInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verbose diagnostic channel: request URLs, request and response bodies and decode results.
 * Credentials in the {@code Authorization} header are always redacted.
 *
 * <p>Disabled unless switched on. Switching is safe while requests are in flight; a request already past the
 * logging interceptor simply keeps the level it saw.
 */
public class DiagnosticLog {

  static final String LOGGER_NAME = "io.wisetime.toggl.diagnostic";

  private static final Logger log = LoggerFactory.getLogger(LOGGER_NAME);

  private final HttpLoggingInterceptor httpInterceptor = new HttpLoggingInterceptor(log::info);
  private volatile boolean enabled;

  public DiagnosticLog(boolean enabled) {
    httpInterceptor.redactHeader("Authorization");
    setEnabled(enabled);
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
    httpInterceptor.level(enabled ? HttpLoggingInterceptor.Level.BODY : HttpLoggingInterceptor.Level.NONE);
  }

  public void enable() {
    setEnabled(true);
  }

  public void disable() {
    setEnabled(false);
  }

  void log(String format, Object... arguments) {
    if (enabled) {
      log.info(format, arguments);
    }
  }

  HttpLoggingInterceptor httpInterceptor() {
    return httpInterceptor;
  }
}
