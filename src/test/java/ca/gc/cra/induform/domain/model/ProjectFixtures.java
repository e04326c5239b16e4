package ca.gc.cra.induform.domain.model;

import ca.gc.cra.induform.domain.compliance.ComplianceStandard;
import java.util.List;

/** Project builders shared by engine tests; mirror the YAML documents under {@code projects/}. */
public final class ProjectFixtures {
  private ProjectFixtures() {}

  /** Enterprise, DMZ, site and cell zones chained through the DMZ with inspection on every conduit. */
  public static Project referencePlant() {
    Zone enterprise = Zone.of("enterprise", "Enterprise Network", ZoneType.ENTERPRISE, 1)
        .withAssets(List.of(Asset.of("erp_server", "ERP Server", AssetType.SERVER).withIpAddress("10.0.0.10")));
    Zone dmz = Zone.of("dmz", "Industrial DMZ", ZoneType.DMZ, 3)
        .withAssets(List.of(
            Asset.of("historian_mirror", "Historian Mirror", AssetType.HISTORIAN).withIpAddress("10.1.0.20")));
    Zone site = Zone.of("site_ops", "Site Operations", ZoneType.SITE, 2)
        .withAssets(List.of(
            Asset.of("scada_server", "SCADA Server", AssetType.SCADA).withIpAddress("10.2.0.30").withCriticality(4)));
    Zone cell = Zone.of("cell_line1", "Line 1 Cell", ZoneType.CELL, 3)
        .withParentZone("site_ops")
        .withAssets(List.of(
            Asset.of("plc_line1", "Line 1 PLC", AssetType.PLC).withIpAddress("10.3.0.40").withCriticality(5)));
    return new Project(
        new ProjectMetadata("Reference Plant", null,
            List.of(ComplianceStandard.IEC62443, ComplianceStandard.PURDUE), List.of(), null, null),
        List.of(enterprise, dmz, site, cell),
        List.of(
            Conduit.of("enterprise_to_dmz", "enterprise", "dmz", List.of(ProtocolFlow.of("https", 443)))
                .withRequiresInspection(true),
            Conduit.of("dmz_to_site", "dmz", "site_ops", List.of(ProtocolFlow.of("opcua", 4840)))
                .withRequiresInspection(true),
            Conduit.of("site_to_cell", "site_ops", "cell_line1", List.of(ProtocolFlow.of("modbus_tcp", 502)))
                .withRequiresInspection(true)));
  }

  /** Enterprise zone linked straight to a PLC cell while an unused DMZ exists. */
  public static Project dmzBypass() {
    return new Project(
        ProjectMetadata.named("DMZ Bypass"),
        List.of(
            Zone.of("enterprise", "Enterprise Network", ZoneType.ENTERPRISE, 1),
            Zone.of("dmz", "Industrial DMZ", ZoneType.DMZ, 3),
            Zone.of("plc_cell", "PLC Cell", ZoneType.CELL, 3)
                .withAssets(List.of(Asset.of("plc_1", "Main PLC", AssetType.PLC).withIpAddress("192.168.10.5")))),
        List.of(Conduit.of("direct_link", "enterprise", "plc_cell", List.of(ProtocolFlow.of("modbus_tcp", 502)))));
  }

  public static Project project(List<Zone> zones, List<Conduit> conduits) {
    return new Project(ProjectMetadata.named("Fixture"), zones, conduits);
  }

  public static Project project(List<ComplianceStandard> standards, List<Zone> zones, List<Conduit> conduits) {
    return new Project(new ProjectMetadata("Fixture", null, standards, List.of(), null, null), zones, conduits);
  }
}
