package io.b2mash.dashhub.integration.qbittorrent;

import io.b2mash.dashhub.integration.capability.Capability;
import java.util.List;

/** qBittorrent WebUI API v2 operations, relative to {@code /api/v2}. POST bodies are forms. */
final class QBittorrentCapabilities {

  private static final String DOCS =
      "https://github.com/qbittorrent/qBittorrent/wiki/WebUI-API-(qBittorrent-4.1)";

  private static final String HASHES = "Torrent hashes separated by | (or 'all')";

  static final List<Capability> CATALOG =
      List.of(
          Capability.get("app-version", "/app/version")
              .name("Get Application Version")
              .category("Application")
              .implemented()
              .docs(DOCS)
              .build(),
          Capability.get("app-api-version", "/app/webapiVersion")
              .name("Get API Version")
              .category("Application")
              .implemented()
              .build(),
          Capability.get("app-preferences", "/app/preferences")
              .name("Get Preferences")
              .description("Get application preferences")
              .category("Application")
              .build(),
          Capability.get("app-default-save-path", "/app/defaultSavePath")
              .name("Get Default Save Path")
              .category("Application")
              .build(),
          Capability.get("transfer-info", "/transfer/info")
              .name("Get Transfer Info")
              .description("Global transfer speeds, limits and totals")
              .category("Transfer")
              .implemented()
              .build(),
          Capability.get("transfer-speed-limits-mode", "/transfer/speedLimitsMode")
              .name("Get Alternative Speed Limits State")
              .category("Transfer")
              .build(),
          Capability.post("transfer-toggle-speed-limits", "/transfer/toggleSpeedLimitsMode")
              .name("Toggle Alternative Speed Limits")
              .category("Transfer")
              .implemented()
              .build(),
          Capability.post("transfer-set-download-limit", "/transfer/setDownloadLimit")
              .name("Set Global Download Limit")
              .category("Transfer")
              .param("limit", "number", true, "Limit in bytes/second (0 for unlimited)")
              .build(),
          Capability.post("transfer-set-upload-limit", "/transfer/setUploadLimit")
              .name("Set Global Upload Limit")
              .category("Transfer")
              .param("limit", "number", true, "Limit in bytes/second (0 for unlimited)")
              .build(),
          Capability.get("torrents-list", "/torrents/info")
              .name("List Torrents")
              .category("Torrents")
              .implemented()
              .param("filter", "string", false, "all, downloading, seeding, completed, paused, ...")
              .param("category", "string", false, "Filter by category")
              .param("tag", "string", false, "Filter by tag")
              .param("sort", "string", false, "Sort by field")
              .param("limit", "number", false, "Maximum number of torrents")
              .build(),
          Capability.get("torrent-properties", "/torrents/properties")
              .name("Get Torrent Properties")
              .category("Torrents")
              .param("hash", "string", true, "Torrent hash")
              .build(),
          Capability.get("torrent-trackers", "/torrents/trackers")
              .name("Get Torrent Trackers")
              .category("Torrents")
              .param("hash", "string", true, "Torrent hash")
              .build(),
          Capability.get("torrent-files", "/torrents/files")
              .name("Get Torrent Files")
              .category("Torrents")
              .param("hash", "string", true, "Torrent hash")
              .build(),
          Capability.post("torrent-add", "/torrents/add")
              .name("Add Torrent")
              .description("Add a torrent by URL or magnet link")
              .category("Torrents")
              .param("urls", "string", true, "URLs or magnet links separated by newlines")
              .param("savepath", "string", false, "Download folder")
              .param("category", "string", false, "Category")
              .param("tags", "string", false, "Comma-separated tags")
              .build(),
          Capability.post("torrent-pause", "/torrents/pause")
              .name("Pause Torrents")
              .category("Torrents")
              .implemented()
              .param("hashes", "string", true, HASHES)
              .build(),
          Capability.post("torrent-resume", "/torrents/resume")
              .name("Resume Torrents")
              .category("Torrents")
              .implemented()
              .param("hashes", "string", true, HASHES)
              .build(),
          Capability.post("torrent-delete", "/torrents/delete")
              .name("Delete Torrents")
              .category("Torrents")
              .param("hashes", "string", true, HASHES)
              .param("deleteFiles", "boolean", true, "Also delete downloaded data")
              .build(),
          Capability.post("torrent-recheck", "/torrents/recheck")
              .name("Recheck Torrents")
              .category("Torrents")
              .implemented()
              .param("hashes", "string", true, HASHES)
              .build(),
          Capability.post("torrent-reannounce", "/torrents/reannounce")
              .name("Reannounce Torrents")
              .category("Torrents")
              .param("hashes", "string", true, HASHES)
              .build(),
          Capability.post("torrent-set-category", "/torrents/setCategory")
              .name("Set Torrent Category")
              .category("Torrents")
              .param("hashes", "string", true, HASHES)
              .param("category", "string", true, "Category name (empty to clear)")
              .build(),
          Capability.post("torrent-set-force-start", "/torrents/setForceStart")
              .name("Set Force Start")
              .category("Torrents")
              .param("hashes", "string", true, HASHES)
              .param("value", "boolean", true, "Enable or disable force start")
              .build(),
          Capability.get("categories-list", "/torrents/categories")
              .name("List Categories")
              .category("Categories")
              .implemented()
              .build(),
          Capability.post("category-create", "/torrents/createCategory")
              .name("Create Category")
              .category("Categories")
              .param("category", "string", true, "Category name")
              .param("savePath", "string", false, "Save path")
              .build(),
          Capability.get("tags-list", "/torrents/tags")
              .name("List Tags")
              .category("Tags")
              .implemented()
              .build(),
          Capability.post("tags-create", "/torrents/createTags")
              .name("Create Tags")
              .category("Tags")
              .param("tags", "string", true, "Comma-separated tag names")
              .build(),
          Capability.get("rss-items", "/rss/items")
              .name("Get RSS Items")
              .category("RSS")
              .param("withData", "boolean", false, "Include feed articles")
              .build(),
          Capability.post("search-start", "/search/start")
              .name("Start Search")
              .category("Search")
              .param("pattern", "string", true, "Search pattern")
              .param("plugins", "string", true, "Search plugins (all or specific)")
              .param("category", "string", true, "Category (all or specific)")
              .build());

  private QBittorrentCapabilities() {}
}
