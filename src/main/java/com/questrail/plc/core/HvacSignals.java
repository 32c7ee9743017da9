package com.questrail.plc.core;

/**
 * Names of the HVAC process variables shared by the default controller, the
 * register bridge and the programs written for this plant.
 */
public final class HvacSignals
{
    private HvacSignals() {}

    // Inputs
    public static final String SYSTEM_ENABLE = "SystemEnable";
    public static final String ROOM_TEMPERATURE = "RoomTemperature";
    public static final String ROOM_HUMIDITY = "RoomHumidity";
    public static final String SETPOINT_TEMP = "SetpointTemp";
    public static final String SETPOINT_HUMIDITY = "SetpointHumidity";
    public static final String TEMP_DEADBAND = "TempDeadband";
    public static final String HUMIDITY_DEADBAND = "HumidityDeadband";

    // Outputs
    public static final String FAN_SPEED = "FanSpeed";
    public static final String CHILLER_ON = "ChillerOn";
    public static final String SYSTEM_STATUS = "SystemStatus";
    public static final String ALARM_ACTIVE = "AlarmActive";

    // Internals
    public static final String TEMP_ERROR = "TempError";
    public static final String HUMIDITY_ERROR = "HumidityError";
    public static final String COOLING_REQUIRED = "CoolingRequired";
    public static final String DEHUMID_REQUIRED = "DehumidRequired";

    /** {@code SystemStatus} when the system is disabled. */
    public static final int STATUS_OFF = 0;
    /** {@code SystemStatus} while cooling or dehumidifying. */
    public static final int STATUS_COOLING = 1;
    /** {@code SystemStatus} when enabled with nothing to do. */
    public static final int STATUS_IDLE = 2;
}
