/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl;

import static org.assertj.core.api.Assertions.assertThat;

import okhttp3.logging.HttpLoggingInterceptor;
import org.junit.jupiter.api.Test;

class DiagnosticLogTest {

  @Test
  void disabledByDefaultConfig() {
    DiagnosticLog diagnosticLog = new TogglSessionFactory(TogglConfig.defaults()).getDiagnosticLog();

    assertThat(diagnosticLog.isEnabled()).isFalse();
    assertThat(diagnosticLog.httpInterceptor().getLevel()).isEqualTo(HttpLoggingInterceptor.Level.NONE);
  }

  @Test
  void enabledFromConfig() {
    DiagnosticLog diagnosticLog = new TogglSessionFactory(TogglConfig.builder().diagnosticLogging(true).build())
        .getDiagnosticLog();

    assertThat(diagnosticLog.isEnabled()).isTrue();
    assertThat(diagnosticLog.httpInterceptor().getLevel()).isEqualTo(HttpLoggingInterceptor.Level.BODY);
  }

  @Test
  void toggleAtRuntime() {
    DiagnosticLog diagnosticLog = new DiagnosticLog(false);

    diagnosticLog.enable();
    assertThat(diagnosticLog.isEnabled()).isTrue();
    assertThat(diagnosticLog.httpInterceptor().getLevel()).isEqualTo(HttpLoggingInterceptor.Level.BODY);

    diagnosticLog.disable();
    assertThat(diagnosticLog.isEnabled()).isFalse();
    assertThat(diagnosticLog.httpInterceptor().getLevel()).isEqualTo(HttpLoggingInterceptor.Level.NONE);
  }
}
