/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl;

import com.github.javafaker.Faker;
import io.wisetime.toggl.model.Client;
import io.wisetime.toggl.model.Project;
import io.wisetime.toggl.model.Tag;
import io.wisetime.toggl.model.TimeEntry;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * @author pascal
 */
public class RandomDataGenerator {

  private static final Faker FAKER = new Faker();

  public TimeEntry randomStoppedTimeEntry(long workspaceId, OffsetDateTime start) {
    return randomTimeEntry(workspaceId)
        .setStartTime(start, true)
        .setDuration(FAKER.number().numberBetween(60L, 7_200L));
  }

  public TimeEntry randomRunningTimeEntry(long workspaceId, OffsetDateTime start) {
    return randomTimeEntry(workspaceId)
        .markRunning(start);
  }

  public Project randomProject(long workspaceId) {
    return new Project()
        .setWorkspaceId(workspaceId)
        .setId(FAKER.number().numberBetween(1L, 10_000_000L))
        .setName(FAKER.company().name())
        .setActive(true);
  }

  public Tag randomTag(long workspaceId) {
    return new Tag()
        .setWorkspaceId(workspaceId)
        .setId(FAKER.number().numberBetween(1L, 10_000_000L))
        .setName(FAKER.lorem().word());
  }

  public Client randomClient(long workspaceId) {
    return new Client()
        .setWorkspaceId(workspaceId)
        .setId(FAKER.number().numberBetween(1L, 10_000_000L))
        .setName(FAKER.company().name())
        .setNotes(FAKER.lorem().sentence());
  }

  private TimeEntry randomTimeEntry(long workspaceId) {
    List<String> tags = new ArrayList<>();
    tags.add(FAKER.lorem().word() + "-a");
    tags.add(FAKER.lorem().word() + "-b");
    return new TimeEntry()
        .setWorkspaceId(workspaceId)
        .setId(FAKER.number().numberBetween(1L, 10_000_000L))
        .setProjectId(FAKER.number().numberBetween(1L, 10_000_000L))
        .setTaskId(FAKER.number().numberBetween(1L, 10_000_000L))
        .setDescription(FAKER.lorem().sentence())
        .setTags(tags)
        .setBillable(FAKER.bool().bool());
  }
}
