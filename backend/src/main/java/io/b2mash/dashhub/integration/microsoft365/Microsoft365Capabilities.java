package io.b2mash.dashhub.integration.microsoft365;

import io.b2mash.dashhub.integration.capability.Capability;
import java.util.List;

/** Microsoft Graph v1.0 operations relevant to the dashboard. Listed for discovery only. */
final class Microsoft365Capabilities {

  static final List<Capability> CATALOG =
      List.of(
          Capability.get("get-me", "/me")
              .name("Get Current User")
              .description("Get the signed-in user profile")
              .category("User")
              .implemented()
              .docs("https://learn.microsoft.com/en-us/graph/api/user-get")
              .build(),
          Capability.get("get-presence", "/me/presence")
              .name("Get Presence")
              .category("User")
              .implemented()
              .build(),
          Capability.get("get-manager", "/me/manager")
              .name("Get Manager")
              .category("User")
              .implemented()
              .build(),
          Capability.get("get-photo", "/me/photo/$value")
              .name("Get Profile Photo")
              .category("User")
              .implemented()
              .build(),
          Capability.get("get-inbox", "/me/mailFolders/Inbox")
              .name("Get Inbox")
              .description("Inbox folder with unread count")
              .category("Mail")
              .implemented()
              .build(),
          Capability.get("list-messages", "/me/messages")
              .name("List Messages")
              .category("Mail")
              .implemented()
              .param("$top", "number", false, "Number of messages to return")
              .param("$orderby", "string", false, "Sort order")
              .param("$filter", "string", false, "Filter criteria")
              .build(),
          Capability.get("get-message", "/me/messages/{id}")
              .name("Get Message")
              .category("Mail")
              .param("id", "string", true, "Message ID")
              .build(),
          Capability.get("list-mail-folders", "/me/mailFolders")
              .name("List Mail Folders")
              .category("Mail")
              .build(),
          Capability.get("list-events", "/me/events")
              .name("List Events")
              .category("Calendar")
              .build(),
          Capability.get("get-calendar-view", "/me/calendarView")
              .name("Get Calendar View")
              .description("Events in a date range")
              .category("Calendar")
              .implemented()
              .param("startDateTime", "string", true, "Start date (ISO 8601)")
              .param("endDateTime", "string", true, "End date (ISO 8601)")
              .build(),
          Capability.get("list-calendars", "/me/calendars")
              .name("List Calendars")
              .category("Calendar")
              .build(),
          Capability.get("get-drive", "/me/drive")
              .name("Get Drive")
              .description("OneDrive storage quota")
              .category("OneDrive")
              .build(),
          Capability.get("list-recent-files", "/me/drive/recent")
              .name("List Recent Files")
              .category("OneDrive")
              .build(),
          Capability.get("list-joined-teams", "/me/joinedTeams")
              .name("List Joined Teams")
              .category("Teams")
              .build(),
          Capability.get("list-chats", "/me/chats")
              .name("List Chats")
              .category("Teams")
              .build(),
          Capability.get("list-todo-lists", "/me/todo/lists")
              .name("List To Do Lists")
              .category("Tasks")
              .implemented()
              .build(),
          Capability.get("list-tasks", "/me/todo/lists/{listId}/tasks")
              .name("List Tasks")
              .category("Tasks")
              .implemented()
              .param("listId", "string", true, "To Do list ID")
              .build(),
          Capability.post("create-task", "/me/todo/lists/{listId}/tasks")
              .name("Create Task")
              .category("Tasks")
              .param("listId", "string", true, "To Do list ID")
              .param("title", "string", true, "Task title")
              .build());

  private Microsoft365Capabilities() {}
}
