package com.questrail.radarlink.protocol.icd.model;

/**
 * MessageKind
 * -----------------------------------------------------------------------------
 * The message types named by the ICD, each with its default wire identifier.
 *
 * <p>The identifier here is only the <em>default</em> assignment. The binding
 * actually used on a link lives in {@link MessageCatalog}, which may reassign
 * identifiers for a given radar build.</p>
 *
 * <p>Kinds without a structured payload decoder (maintenance, BIT, resource
 * requests, the vendor data stream) are still named so that logs and
 * {@link GenericMessage} renderings can show something better than a hex id.</p>
 */
public enum MessageKind
{
    KEEP_ALIVE(0xCEF0_0400L, "Keep Alive"),
    SYSTEM_CONTROL(0xCEF0_0401L, "System Control"),
    SYSTEM_MOTION(0xCEF0_0402L, "System Motion"),
    SYSTEM_STATUS(0xCEF0_0403L, "System Status"),
    TARGET_REPORT(0xCEF0_0404L, "Target Report"),
    ACKNOWLEDGE(0xCEF0_0405L, "Acknowledge"),
    SINGLE_TARGET_REPORT(0xCEF0_0406L, "Single Target Report"),
    MAINTENANCE_DATA(0xCEF0_0407L, "Maintenance Data"),
    SINGLE_TARGET_EXTENDED(0xCEF0_0408L, "Single Target Extended"),
    BIT_STATUS_DATA(0xCEF0_0409L, "BIT Status Data"),
    BIT_REQUEST(0xCEF0_040AL, "BIT Request"),
    RESOURCE_REQUEST(0xCEF0_040BL, "Resource Request"),
    MAINTENANCE_REQUEST(0xCEF0_040CL, "Maintenance Request"),
    SET_SENSOR_POSITION(0xCEF0_0418L, "Set Sensor Position"),
    GET_SENSOR_POSITION(0xCEF0_0419L, "Get Sensor Position"),
    SENSOR_POSITION(0xCEF0_041AL, "Sensor Position"),

    /** Vendor stream seen on live links; not part of the ICD catalog proper. */
    RADAR_DATA_STREAM(0x0000_0210L, "Radar Data Stream");

    private final long defaultId;
    private final String displayName;

    MessageKind(long defaultId, String displayName) {
        this.defaultId = defaultId;
        this.displayName = displayName;
    }

    public long defaultId() {
        return defaultId;
    }

    public String displayName() {
        return displayName;
    }
}
