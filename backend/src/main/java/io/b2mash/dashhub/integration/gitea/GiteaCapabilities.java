package io.b2mash.dashhub.integration.gitea;

import io.b2mash.dashhub.integration.capability.Capability;
import java.util.List;

/** Gitea REST API v1 operations, relative to {@code /api/v1}. */
final class GiteaCapabilities {

  private static final String DOCS = "https://docs.gitea.com/api/1.22/";

  static final List<Capability> CATALOG =
      List.of(
          Capability.get("user-get", "/user")
              .name("Get Authenticated User")
              .description("Get the authenticated user profile")
              .category("User")
              .implemented()
              .docs(DOCS)
              .build(),
          Capability.get("user-get-by-username", "/users/{username}")
              .name("Get User by Username")
              .description("Get a specific user profile")
              .category("User")
              .param("username", "string", true, "Gitea username")
              .build(),
          Capability.get("user-heatmap", "/users/{username}/heatmap")
              .name("Get User Heatmap")
              .description("Get contribution heatmap for a user")
              .category("User")
              .implemented()
              .param("username", "string", true, "Gitea username")
              .build(),
          Capability.get("repos-list-user", "/user/repos")
              .name("List User Repositories")
              .description("List repositories for the authenticated user")
              .category("Repositories")
              .implemented()
              .param("page", "number", false, "Page number")
              .param("limit", "number", false, "Page size (max 50)")
              .build(),
          Capability.get("repos-get", "/repos/{owner}/{repo}")
              .name("Get Repository")
              .description("Get a specific repository")
              .category("Repositories")
              .param("owner", "string", true, "Repository owner")
              .param("repo", "string", true, "Repository name")
              .build(),
          Capability.get("repos-search", "/repos/search")
              .name("Search Repositories")
              .description("Search for repositories")
              .category("Repositories")
              .param("q", "string", false, "Search query")
              .param("topic", "boolean", false, "Search topics")
              .param("includeDesc", "boolean", false, "Include description")
              .build(),
          Capability.get("issues-search", "/repos/issues/search")
              .name("Search Issues")
              .description("Search issues across repositories")
              .category("Issues")
              .implemented()
              .param("state", "string", false, "open, closed, or all")
              .param("labels", "string", false, "Comma-separated label names")
              .param("type", "string", false, "issues or pulls")
              .build(),
          Capability.get("issues-list-repo", "/repos/{owner}/{repo}/issues")
              .name("List Repository Issues")
              .description("List issues for a repository")
              .category("Issues")
              .param("owner", "string", true, "Repository owner")
              .param("repo", "string", true, "Repository name")
              .param("state", "string", false, "open, closed, or all")
              .build(),
          Capability.get("pulls-list-repo", "/repos/{owner}/{repo}/pulls")
              .name("List Repository Pull Requests")
              .description("List pull requests for a repository")
              .category("Pull Requests")
              .implemented()
              .param("owner", "string", true, "Repository owner")
              .param("repo", "string", true, "Repository name")
              .param("state", "string", false, "open, closed, or all")
              .build(),
          Capability.get("orgs-list-user", "/user/orgs")
              .name("List User Organizations")
              .description("List organizations for the authenticated user")
              .category("Organizations")
              .implemented()
              .build(),
          Capability.get("orgs-get", "/orgs/{org}")
              .name("Get Organization")
              .description("Get a specific organization")
              .category("Organizations")
              .param("org", "string", true, "Organization name")
              .build(),
          Capability.get("orgs-teams", "/orgs/{org}/teams")
              .name("List Organization Teams")
              .description("List teams for an organization")
              .category("Organizations")
              .implemented()
              .param("org", "string", true, "Organization name")
              .build(),
          Capability.get("notifications-list", "/notifications")
              .name("List Notifications")
              .description("List all notifications for the authenticated user")
              .category("Notifications")
              .implemented()
              .param("all", "boolean", false, "Show all notifications")
              .param("status-types", "array", false, "Filter by status types")
              .build(),
          Capability.get("notifications-new", "/notifications/new")
              .name("Check New Notifications")
              .description("Check for new unread notifications")
              .category("Notifications")
              .implemented()
              .build(),
          Capability.patch("notifications-mark-read", "/notifications/threads/{id}")
              .name("Mark Notification as Read")
              .description("Mark a notification thread as read")
              .category("Notifications")
              .param("id", "string", true, "Notification thread ID")
              .build());

  private GiteaCapabilities() {}
}
