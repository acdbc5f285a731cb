/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl;

/**
 * Builds resource paths relative to the Toggl API root. Ids are passed through as given.
 */
public final class ResourcePaths {

  private ResourcePaths() {
  }

  /**
   * {@code /me/{resource}}
   */
  public static String userResource(ResourceType resourceType) {
    return "/me/" + resourceType.getPathSegment();
  }

  /**
   * {@code /workspaces/{wid}/{resource}}
   */
  public static String workspaceResource(ResourceType resourceType, long workspaceId) {
    return "/workspaces/" + workspaceId + "/" + resourceType.getPathSegment();
  }

  /**
   * {@code /workspaces/{wid}/{resource}/{id}}
   */
  public static String workspaceResource(ResourceType resourceType, long workspaceId, long id) {
    return workspaceResource(resourceType, workspaceId) + "/" + id;
  }
}
