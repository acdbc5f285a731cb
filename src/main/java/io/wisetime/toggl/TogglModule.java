/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl;

import com.google.gson.Gson;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.wisetime.toggl.json.TogglGson;
import okhttp3.OkHttpClient;

/**
 * Guice bindings for {@link TogglSessionFactory}.
 */
public class TogglModule extends AbstractModule {

  private final TogglConfig config;

  public TogglModule(TogglConfig config) {
    this.config = config;
  }

  @Override
  protected void configure() {
    bind(TogglConfig.class).toInstance(config);
    bind(TogglSessionFactory.class).in(Singleton.class);
  }

  @Provides
  @Singleton
  OkHttpClient provideHttpClient() {
    return new OkHttpClient();
  }

  @Provides
  @Singleton
  Gson provideGson() {
    return TogglGson.create();
  }
}
