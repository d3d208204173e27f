package io.b2mash.dashhub.integration.pikvm;

import io.b2mash.dashhub.integration.capability.Capability;
import java.util.List;

/** kvmd HTTP API operations. Parameters travel in the query string. */
final class PikvmCapabilities {

  private static final String DOCS = "https://docs.pikvm.org/api/";

  static final List<Capability> CATALOG =
      List.of(
          Capability.get("auth-check", "/api/auth/check")
              .name("Check Auth")
              .category("Authentication")
              .docs(DOCS)
              .build(),
          Capability.get("info", "/api/info")
              .name("Get System Info")
              .description("Hardware, software versions and system state")
              .category("System")
              .implemented()
              .param("fields", "string", false, "Comma-separated list of fields to return")
              .docs(DOCS)
              .build(),
          Capability.get("log", "/api/log")
              .name("Get System Log")
              .category("System")
              .param("seek", "number", false, "Start position in log")
              .build(),
          Capability.get("atx-state", "/api/atx")
              .name("Get ATX State")
              .description("Power and HDD LED state")
              .category("ATX Power")
              .implemented()
              .build(),
          Capability.post("atx-power", "/api/atx/power")
              .name("ATX Power Control")
              .category("ATX Power")
              .implemented()
              .param("action", "string", true, "Power action: on, off, off_hard, reset_hard")
              .build(),
          Capability.post("atx-click", "/api/atx/click")
              .name("ATX Button Click")
              .category("ATX Power")
              .param("button", "string", true, "Button to press: power, power_long, reset")
              .build(),
          Capability.get("msd-state", "/api/msd")
              .name("Get MSD State")
              .category("Mass Storage Device")
              .implemented()
              .build(),
          Capability.post("msd-write-remote", "/api/msd/write_remote")
              .name("Upload Image from URL")
              .category("Mass Storage Device")
              .param("url", "string", true, "URL of the image to download")
              .build(),
          Capability.post("msd-set-params", "/api/msd/set_params")
              .name("Set MSD Parameters")
              .category("Mass Storage Device")
              .param("image", "string", false, "Image filename to select")
              .param("cdrom", "boolean", false, "Present as CD-ROM device")
              .param("rw", "boolean", false, "Enable read-write mode")
              .build(),
          Capability.post("msd-connect", "/api/msd/set_connected")
              .name("Connect/Disconnect MSD")
              .category("Mass Storage Device")
              .param("connected", "boolean", true, "True to connect, false to disconnect")
              .build(),
          Capability.post("msd-remove", "/api/msd/remove")
              .name("Remove Image")
              .category("Mass Storage Device")
              .param("image", "string", true, "Image filename to delete")
              .build(),
          Capability.post("msd-reset", "/api/msd/reset")
              .name("Reset MSD")
              .category("Mass Storage Device")
              .build(),
          Capability.get("hid-state", "/api/hid")
              .name("Get HID State")
              .category("HID (Keyboard/Mouse)")
              .build(),
          Capability.post("hid-set-connected", "/api/hid/set_connected")
              .name("Connect/Disconnect HID")
              .category("HID (Keyboard/Mouse)")
              .param("connected", "boolean", true, "True to connect, false to disconnect")
              .build(),
          Capability.post("hid-reset", "/api/hid/reset")
              .name("Reset HID")
              .category("HID (Keyboard/Mouse)")
              .build(),
          Capability.get("hid-keymaps", "/api/hid/keymaps")
              .name("List Keymaps")
              .category("HID (Keyboard/Mouse)")
              .build(),
          Capability.post("hid-send-shortcut", "/api/hid/events/send_shortcut")
              .name("Send Shortcut")
              .category("HID (Keyboard/Mouse)")
              .param(
                  "keys",
                  "string",
                  true,
                  "Comma-separated key names, e.g. ControlLeft,AltLeft,Delete")
              .build(),
          Capability.post("hid-send-key", "/api/hid/events/send_key")
              .name("Send Key")
              .category("HID (Keyboard/Mouse)")
              .param("key", "string", true, "Key name")
              .param("state", "boolean", false, "Pressed (true) or released (false)")
              .build(),
          Capability.get("streamer-state", "/api/streamer")
              .name("Get Streamer State")
              .category("Video Streamer")
              .implemented()
              .build(),
          Capability.delete("streamer-delete-snapshot", "/api/streamer/snapshot")
              .name("Delete Snapshot")
              .category("Video Streamer")
              .build(),
          Capability.get("gpio-state", "/api/gpio")
              .name("Get GPIO State")
              .category("GPIO")
              .build(),
          Capability.post("gpio-switch", "/api/gpio/switch")
              .name("Switch GPIO Channel")
              .category("GPIO")
              .param("channel", "string", true, "GPIO channel")
              .param("state", "boolean", true, "Target state")
              .build(),
          Capability.post("gpio-pulse", "/api/gpio/pulse")
              .name("Pulse GPIO Channel")
              .category("GPIO")
              .param("channel", "string", true, "GPIO channel")
              .param("delay", "number", false, "Pulse length in seconds")
              .build(),
          Capability.get("switch-state", "/api/switch")
              .name("Get KVM Switch State")
              .category("KVM Switch")
              .build(),
          Capability.post("switch-set-active", "/api/switch/set_active")
              .name("Set Active Port")
              .category("KVM Switch")
              .param("port", "string", true, "Port to activate")
              .build(),
          Capability.get("redfish-system-info", "/api/redfish/v1/Systems/0")
              .name("Redfish System Info")
              .category("Redfish API")
              .build(),
          Capability.get("prometheus-metrics", "/api/export/prometheus/metrics")
              .name("Prometheus Metrics")
              .category("Monitoring")
              .build());

  private PikvmCapabilities() {}
}
