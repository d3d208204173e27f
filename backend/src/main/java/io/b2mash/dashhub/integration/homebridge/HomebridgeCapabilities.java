package io.b2mash.dashhub.integration.homebridge;

import io.b2mash.dashhub.integration.capability.Capability;
import java.util.List;

/** homebridge-config-ui-x REST API operations. */
final class HomebridgeCapabilities {

  private static final String DOCS =
      "https://github.com/homebridge/homebridge-config-ui-x/wiki/API";

  static final List<Capability> CATALOG =
      List.of(
          Capability.get("auth-check", "/api/auth/check")
              .name("Check Authentication")
              .description("Verify the current token is valid")
              .category("Authentication")
              .docs(DOCS)
              .build(),
          Capability.get("status-homebridge", "/api/status/homebridge")
              .name("Get Homebridge Status")
              .category("Status")
              .implemented()
              .build(),
          Capability.get("status-server-info", "/api/status/server-information")
              .name("Get Server Information")
              .category("Status")
              .implemented()
              .build(),
          Capability.get("status-homebridge-version", "/api/status/homebridge-version")
              .name("Get Homebridge Version")
              .category("Status")
              .implemented()
              .build(),
          Capability.get("status-cpu", "/api/status/cpu")
              .name("Get CPU Usage")
              .category("Status")
              .implemented()
              .build(),
          Capability.get("status-ram", "/api/status/ram")
              .name("Get Memory Usage")
              .category("Status")
              .implemented()
              .build(),
          Capability.get("status-network", "/api/status/network")
              .name("Get Network Usage")
              .category("Status")
              .build(),
          Capability.get("status-uptime", "/api/status/uptime")
              .name("Get Uptime")
              .category("Status")
              .build(),
          Capability.get("accessories-list", "/api/accessories")
              .name("List Accessories")
              .description("Requires Homebridge insecure mode")
              .category("Accessories")
              .implemented()
              .build(),
          Capability.get("accessories-get", "/api/accessories/{uniqueId}")
              .name("Get Accessory")
              .category("Accessories")
              .param("uniqueId", "string", true, "Accessory unique ID")
              .build(),
          Capability.put("accessories-set-characteristic", "/api/accessories/{uniqueId}")
              .name("Set Accessory Characteristic")
              .category("Accessories")
              .implemented()
              .param("uniqueId", "string", true, "Accessory unique ID")
              .param("characteristicType", "string", true, "Characteristic type, e.g. On")
              .param("value", "string", true, "New value")
              .build(),
          Capability.get("accessories-layout", "/api/accessories/layout")
              .name("Get Accessory Layout")
              .category("Accessories")
              .build(),
          Capability.get("plugins-list", "/api/plugins")
              .name("List Installed Plugins")
              .category("Plugins")
              .implemented()
              .build(),
          Capability.get("plugins-search", "/api/plugins/search/{query}")
              .name("Search Plugins")
              .category("Plugins")
              .param("query", "string", true, "Search query")
              .build(),
          Capability.get("plugins-lookup", "/api/plugins/lookup/{pluginName}")
              .name("Lookup Plugin")
              .category("Plugins")
              .param("pluginName", "string", true, "Plugin package name")
              .build(),
          Capability.get("plugins-changelog", "/api/plugins/changelog/{pluginName}")
              .name("Get Plugin Changelog")
              .category("Plugins")
              .param("pluginName", "string", true, "Plugin package name")
              .build(),
          Capability.get("config-editor", "/api/config-editor")
              .name("Get Config")
              .description("Get the Homebridge config.json")
              .category("Configuration")
              .build(),
          Capability.put("server-restart", "/api/server/restart")
              .name("Restart Homebridge")
              .description("Restart the Homebridge service")
              .category("Server Control")
              .implemented()
              .build(),
          Capability.get("server-pairing", "/api/server/pairing")
              .name("Get Pairing Info")
              .description("Get the HomeKit pairing code and setup ID")
              .category("Server Control")
              .build(),
          Capability.get("server-cached-accessories", "/api/server/cached-accessories")
              .name("Get Cached Accessories")
              .category("Server Control")
              .build(),
          Capability.delete(
                  "server-cached-accessories-delete", "/api/server/cached-accessories/{uuid}")
              .name("Delete Cached Accessory")
              .category("Server Control")
              .param("uuid", "string", true, "Accessory UUID")
              .build(),
          Capability.get("child-bridges-list", "/api/status/homebridge/child-bridges")
              .name("List Child Bridges")
              .category("Child Bridges")
              .build(),
          Capability.put("child-bridges-restart", "/api/server/restart/{deviceId}")
              .name("Restart Child Bridge")
              .category("Child Bridges")
              .param("deviceId", "string", true, "Child bridge device ID")
              .build(),
          Capability.get("backup-scheduled", "/api/backup/scheduled-backups")
              .name("List Scheduled Backups")
              .category("Backup")
              .build(),
          Capability.get("users-list", "/api/users")
              .name("List Users")
              .category("Users")
              .build());

  private HomebridgeCapabilities() {}
}
