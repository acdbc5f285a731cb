/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/**
 * @author pascal
 */
class ResourcePathsTest {

  @Test
  void workspaceResource() {
    assertThat(ResourcePaths.workspaceResource(ResourceType.TIME_ENTRIES, 7))
        .isEqualTo("/workspaces/7/time_entries");
    assertThat(ResourcePaths.workspaceResource(ResourceType.CLIENTS, 12))
        .isEqualTo("/workspaces/12/clients");
  }

  @Test
  void workspaceResource_withId() {
    assertThat(ResourcePaths.workspaceResource(ResourceType.TIME_ENTRIES, 7, 42))
        .isEqualTo("/workspaces/7/time_entries/42");
    assertThat(ResourcePaths.workspaceResource(ResourceType.PROJECTS, 7, 3_000_000_000L))
        .isEqualTo("/workspaces/7/projects/3000000000");
  }

  @Test
  void workspaceResource_idsArePassedThroughUnchecked() {
    assertThat(ResourcePaths.workspaceResource(ResourceType.TAGS, 0, -1))
        .isEqualTo("/workspaces/0/tags/-1");
  }

  @Test
  void userResource() {
    assertThat(ResourcePaths.userResource(ResourceType.TIME_ENTRIES))
        .isEqualTo("/me/time_entries");
  }

  @Test
  void relative_stripsLeadingSlash() {
    assertThat(TogglSession.relative("/workspaces/7/tags")).isEqualTo("workspaces/7/tags");
    assertThat(TogglSession.relative("workspaces/7/tags")).isEqualTo("workspaces/7/tags");
  }
}
