package io.b2mash.dashhub.integration.panos;

import io.b2mash.dashhub.integration.capability.Capability;
import java.util.List;

/** PAN-OS XML API operations. Listed for discovery; this adapter does not execute them. */
final class PanosCapabilities {

  private static final String DOCS =
      "https://docs.paloaltonetworks.com/pan-os/11-1/pan-os-panorama-api";

  static final String SYSTEM_INFO = "<show><system><info></info></system></show>";
  static final String INTERFACES_ALL = "<show><interface>all</interface></show>";
  static final String IPSEC_SA = "<show><vpn><ipsec-sa></ipsec-sa></vpn></show>";
  static final String VPN_GATEWAY = "<show><vpn><gateway></gateway></vpn></show>";
  static final String SESSION_INFO = "<show><session><info></info></session></show>";
  static final String HA_STATE =
      "<show><high-availability><state></state></high-availability></show>";

  static final List<Capability> CATALOG =
      List.of(
          op("system-info", "System Information", "System", SYSTEM_INFO, true),
          op(
              "resource-monitor",
              "Resource Monitor",
              "System",
              "<show><running><resource-monitor></resource-monitor></running></show>",
              false),
          op("interfaces-all", "All Interfaces", "Network", INTERFACES_ALL, true),
          op(
              "arp-table",
              "ARP Table",
              "Network",
              "<show><arp><entry name=\"all\"/></arp></show>",
              false),
          op(
              "routing-table",
              "Routing Table",
              "Network",
              "<show><routing><route></route></routing></show>",
              false),
          op("ipsec-sa", "IPsec SA", "VPN", IPSEC_SA, true),
          op("vpn-gateway", "VPN Gateways", "VPN", VPN_GATEWAY, true),
          op("session-info", "Session Info", "Sessions", SESSION_INFO, true),
          op(
              "session-all",
              "All Sessions",
              "Sessions",
              "<show><session><all></all></session></show>",
              false),
          op("ha-state", "HA State", "HA", HA_STATE, true),
          log("traffic-logs", "Traffic Logs", "traffic"),
          log("threat-logs", "Threat Logs", "threat"),
          log("system-logs", "System Logs", "system"),
          op(
              "global-counters",
              "Global Counters",
              "Statistics",
              "<show><counter><global></global></counter></show>",
              false));

  private PanosCapabilities() {}

  private static Capability op(
      String id, String name, String category, String command, boolean implemented) {
    var builder =
        Capability.get(id, "/api/?type=op&cmd=" + command)
            .name(name)
            .description("Operational command " + command)
            .category(category)
            .docs(DOCS);
    if (implemented) {
      builder.implemented();
    }
    return builder.build();
  }

  private static Capability log(String id, String name, String logType) {
    return Capability.get(id, "/api/?type=log&log-type=" + logType + "&nlogs=50")
        .name(name)
        .description("Most recent " + logType + " log entries")
        .category("Logs")
        .docs(DOCS)
        .build();
  }
}
