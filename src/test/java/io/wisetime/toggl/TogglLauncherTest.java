/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.inject.Guice;
import com.google.inject.Injector;
import java.io.IOException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link TogglLauncher} and the Guice wiring it uses.
 *
 * @author pascal
 */
class TogglLauncherTest {

  private MockWebServer server;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void buildSessionFactory_usesGivenConfig() {
    TogglConfig config = TogglConfig.builder().appName("launcher-test").build();

    TogglSessionFactory sessionFactory = TogglLauncher.buildSessionFactory(config);

    assertThat(sessionFactory.getConfig())
        .as("factory is built around the config handed to the module")
        .isSameAs(config);
  }

  @Test
  void module_bindsFactoryAsSingleton() {
    Injector injector = Guice.createInjector(new TogglModule(TogglConfig.defaults()));

    assertThat(injector.getInstance(TogglSessionFactory.class))
        .isSameAs(injector.getInstance(TogglSessionFactory.class));
  }

  @Test
  void fetchAccountJson_printsAccount() {
    server.enqueue(new MockResponse()
        .setHeader("Content-Type", "application/json")
        .setBody("{\"id\": 99, \"api_token\": \"secret\", \"timezone\": \"Australia/Perth\","
            + "\"workspaces\": [{\"id\": 7, \"name\": \"Practice\"}]}"));
    TogglConfig config = TogglConfig.builder()
        .apiBaseUrl(server.url("/api/v9/").toString())
        .build();

    String json = TogglLauncher.fetchAccountJson(TogglLauncher.buildSessionFactory(config), "secret");

    assertThat(json).contains("\n");
    JsonObject account = JsonParser.parseString(json).getAsJsonObject();
    assertThat(account.get("id").getAsLong()).isEqualTo(99);
    assertThat(account.get("timezone").getAsString()).isEqualTo("Australia/Perth");
    assertThat(account.getAsJsonArray("workspaces").get(0).getAsJsonObject().get("name").getAsString())
        .isEqualTo("Practice");
  }
}
