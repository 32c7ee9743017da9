package com.questrail.plc.mapping;

import com.questrail.plc.core.HvacSignals;

/**
 * RegisterSignal
 * =============================================================================
 * Every logical signal that has a holding register, with its zero-based
 * address and word encoding.
 *
 * <p>The label is the process variable name used in PLC memory where one
 * exists ({@code SetpointTemp}, {@code FanSpeed}); the sensor and actuator
 * registers carry plant-side names and are bridged to memory explicitly.</p>
 *
 * <p>The table is fixed at compile time and never changes at runtime.</p>
 */
public enum RegisterSignal
{
    // Commands (supervisory → PLC)
    SYSTEM_ENABLE(HvacSignals.SYSTEM_ENABLE, 0, RegisterEncoding.FLAG),
    SETPOINT_TEMP(HvacSignals.SETPOINT_TEMP, 1, RegisterEncoding.SCALED_X10),
    SETPOINT_HUMIDITY(HvacSignals.SETPOINT_HUMIDITY, 2, RegisterEncoding.SCALED_X10),
    TEMP_DEADBAND(HvacSignals.TEMP_DEADBAND, 3, RegisterEncoding.SCALED_X10),
    HUMIDITY_DEADBAND(HvacSignals.HUMIDITY_DEADBAND, 4, RegisterEncoding.SCALED_X10),

    // Status (PLC → supervisory)
    ROOM_TEMPERATURE(HvacSignals.ROOM_TEMPERATURE, 100, RegisterEncoding.SCALED_X10),
    ROOM_HUMIDITY(HvacSignals.ROOM_HUMIDITY, 101, RegisterEncoding.SCALED_X10),
    FAN_SPEED(HvacSignals.FAN_SPEED, 102, RegisterEncoding.PERCENT),
    CHILLER_ON(HvacSignals.CHILLER_ON, 103, RegisterEncoding.FLAG),
    SYSTEM_STATUS(HvacSignals.SYSTEM_STATUS, 104, RegisterEncoding.WORD),
    ALARM_ACTIVE(HvacSignals.ALARM_ACTIVE, 105, RegisterEncoding.FLAG),

    // Sensors (plant → PLC)
    SENSOR_TEMP("SensorTemp", 200, RegisterEncoding.SCALED_X10),
    SENSOR_HUMIDITY("SensorHumidity", 201, RegisterEncoding.SCALED_X10),

    // Actuators (PLC → plant)
    ACTUATOR_FAN_SPEED("ActuatorFanSpeed", 300, RegisterEncoding.PERCENT),
    ACTUATOR_CHILLER("ActuatorChiller", 301, RegisterEncoding.FLAG);

    private final String label;
    private final int address;
    private final RegisterEncoding encoding;

    RegisterSignal(String label, int address, RegisterEncoding encoding) {
        this.label = label;
        this.address = address;
        this.encoding = encoding;
    }

    public String label() {
        return label;
    }

    public int address() {
        return address;
    }

    public RegisterEncoding encoding() {
        return encoding;
    }

    public RegisterBlock block() {
        return RegisterMap.blockOf(address)
                .orElseThrow(() -> new IllegalStateException("No block for address " + address));
    }
}
