/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl;

import com.google.inject.Guice;
import io.wisetime.toggl.json.TogglGson;
import io.wisetime.toggl.model.Account;
import io.wisetime.toggl.util.TogglException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints a user's Toggl account as JSON.
 *
 * <pre>
 *   TogglLauncher API_TOKEN
 * </pre>
 *
 * The API token can be found on the profile page of the Toggl account.
 *
 * @author pascal
 */
public class TogglLauncher {

  private static final Logger log = LoggerFactory.getLogger(TogglLauncher.class);

  public static void main(final String... args) {
    if (args.length != 1) {
      System.err.println("usage: TogglLauncher API_TOKEN");
      System.exit(2);
      return;
    }

    try {
      System.out.println("account: " + fetchAccountJson(buildSessionFactory(TogglConfig.fromEnvironment()), args[0]));
    } catch (TogglException e) {
      log.error("Unable to fetch Toggl account", e);
      System.exit(1);
    }
  }

  public static TogglSessionFactory buildSessionFactory(TogglConfig config) {
    return Guice.createInjector(new TogglModule(config)).getInstance(TogglSessionFactory.class);
  }

  static String fetchAccountJson(TogglSessionFactory sessionFactory, String apiToken) {
    Account account = sessionFactory.open(apiToken).getAccount();
    return TogglGson.builder().setPrettyPrinting().create().toJson(account);
  }
}
