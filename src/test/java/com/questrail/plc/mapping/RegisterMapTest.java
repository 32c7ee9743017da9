package com.questrail.plc.mapping;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RegisterMapTest {

    @Test
    void addressesAreUniqueAndInsideTheirBlock() {
        Set<Integer> seen = new HashSet<>();
        for (RegisterSignal s : RegisterSignal.values()) {
            assertTrue(seen.add(s.address()), "duplicate address " + s.address());
            assertTrue(s.block().contains(s.address()));
            assertTrue(s.address() < RegisterMap.REGISTER_COUNT);
        }
    }

    @Test
    void blockBoundaries() {
        assertEquals(Optional.of(RegisterBlock.COMMANDS), RegisterMap.blockOf(0));
        assertEquals(Optional.of(RegisterBlock.COMMANDS), RegisterMap.blockOf(99));
        assertEquals(Optional.of(RegisterBlock.STATUS), RegisterMap.blockOf(100));
        assertEquals(Optional.of(RegisterBlock.ACTUATORS), RegisterMap.blockOf(399));
        assertEquals(Optional.empty(), RegisterMap.blockOf(400));
        assertEquals(Optional.empty(), RegisterMap.blockOf(-1));
    }

    @Test
    void signalsInBlockAreInAddressOrder() {
        assertEquals(List.of(
                RegisterSignal.SYSTEM_ENABLE,
                RegisterSignal.SETPOINT_TEMP,
                RegisterSignal.SETPOINT_HUMIDITY,
                RegisterSignal.TEMP_DEADBAND,
                RegisterSignal.HUMIDITY_DEADBAND), RegisterMap.signalsIn(RegisterBlock.COMMANDS));
        assertEquals(List.of(RegisterSignal.ACTUATOR_FAN_SPEED, RegisterSignal.ACTUATOR_CHILLER),
                RegisterMap.signalsIn(RegisterBlock.ACTUATORS));
    }

    @Test
    void lookupByLabelAndAddress() {
        assertEquals(Optional.of(RegisterSignal.FAN_SPEED), RegisterMap.byLabel("FanSpeed"));
        assertEquals(Optional.of(RegisterSignal.SENSOR_TEMP), RegisterMap.byLabel("SensorTemp"));
        assertEquals(Optional.empty(), RegisterMap.byLabel("fanspeed"));

        assertEquals(Optional.of(RegisterSignal.ALARM_ACTIVE), RegisterMap.atAddress(105));
        assertEquals(Optional.of(RegisterSignal.ACTUATOR_CHILLER), RegisterMap.atAddress(301));
        assertEquals(Optional.empty(), RegisterMap.atAddress(5));
    }
}
