package com.questrail.plc.bridge;

import com.questrail.plc.api.BoolValue;
import com.questrail.plc.api.Value;
import com.questrail.plc.api.VariableClass;
import com.questrail.plc.core.HvacSignals;
import com.questrail.plc.core.PlcMemory;
import com.questrail.plc.lang.StParseException;
import com.questrail.plc.lang.StParser;
import com.questrail.plc.mapping.RegisterMap;
import com.questrail.plc.observability.NullObservabilitySink;
import com.questrail.plc.protocol.modbus.client.FakeModbusClient;
import com.questrail.plc.protocol.modbus.server.RegisterTable;
import com.questrail.plc.time.ManualMonotonicClock;
import com.questrail.plc.time.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ModbusBridgeTest {

    private RegisterTable table;
    private FakeModbusClient fake;
    private ModbusBridge bridge;
    private PlcMemory memory;

    @BeforeEach
    void setUp() {
        table = new RegisterTable(RegisterMap.REGISTER_COUNT);
        fake = new FakeModbusClient();
        PlantConnection plant = new PlantConnection(fake.factory(), "plant", Duration.ZERO,
                new RecordingSleeper(new ManualMonotonicClock()), NullObservabilitySink.INSTANCE);
        bridge = new ModbusBridge(table, plant);
        memory = PlcMemory.withHvacDefaults();
    }

    @Test
    void commandDefaultsAreSeeded() {
        bridge.initializeCommandDefaults();

        assertArrayEquals(new int[] { 0, 220, 450, 10, 50 }, table.read(0, 5));
    }

    @Test
    void commandsArePulledIntoInputs() {
        table.write(0, new int[] { 1, 235, 400, 15, 30 });

        bridge.pullCommands(memory);

        assertEquals(Optional.of(BoolValue.TRUE), memory.read(VariableClass.INPUT, HvacSignals.SYSTEM_ENABLE));
        assertEquals(Optional.of(Value.ofReal(23.5)), memory.read(VariableClass.INPUT, HvacSignals.SETPOINT_TEMP));
        assertEquals(Optional.of(Value.ofReal(40.0)), memory.read(VariableClass.INPUT, HvacSignals.SETPOINT_HUMIDITY));
        assertEquals(Optional.of(Value.ofReal(1.5)), memory.read(VariableClass.INPUT, HvacSignals.TEMP_DEADBAND));
        assertEquals(Optional.of(Value.ofReal(3.0)), memory.read(VariableClass.INPUT, HvacSignals.HUMIDITY_DEADBAND));
    }

    @Test
    void commandsKeepTheDeclaredInputType() throws StParseException {
        PlcMemory typed = PlcMemory.forProgram(new StParser().parse(
                "PROGRAM P VAR_INPUT SetpointTemp : INT; END_VAR VAR_OUTPUT SystemEnable : BOOL; END_VAR"
                        + " SystemEnable := FALSE; END_PROGRAM"));
        table.write(0, new int[] { 1, 235 });

        bridge.pullCommands(typed);

        assertEquals(Optional.of(Value.ofInt(23)), typed.read(VariableClass.INPUT, HvacSignals.SETPOINT_TEMP));
        assertEquals(Optional.of(BoolValue.FALSE), typed.read(VariableClass.OUTPUT, HvacSignals.SYSTEM_ENABLE));
        assertTrue(typed.read(VariableClass.INPUT, HvacSignals.SYSTEM_ENABLE).isEmpty());
    }

    @Test
    void plantSensorsAreReadAndMirrored() throws InterruptedException {
        fake.setSensors(253, 612);

        assertTrue(bridge.readPlantInputs(memory));

        assertEquals(Optional.of(Value.ofReal(25.3)), memory.read(VariableClass.INPUT, HvacSignals.ROOM_TEMPERATURE));
        assertEquals(Optional.of(Value.ofReal(61.2)), memory.read(VariableClass.INPUT, HvacSignals.ROOM_HUMIDITY));
        assertArrayEquals(new int[] { 253, 612 }, table.read(200, 2));
        assertArrayEquals(new int[] { 253, 612 }, table.read(100, 2));
    }

    @Test
    void failedReadKeepsPreviousInputsAndDropsConnection() throws InterruptedException {
        fake.setSensors(253, 612);
        bridge.readPlantInputs(memory);
        fake.setSensors(300, 700);
        fake.failReads(true);

        assertFalse(bridge.readPlantInputs(memory));

        assertEquals(Optional.of(Value.ofReal(25.3)), memory.read(VariableClass.INPUT, HvacSignals.ROOM_TEMPERATURE));
        assertFalse(bridge.isPlantConnected());
    }

    @Test
    void unreachablePlantLeavesInputsUntouched() throws InterruptedException {
        fake.refuseConnect(true);

        assertFalse(bridge.readPlantInputs(memory));
        assertEquals(Optional.of(Value.ofReal(20.0)), memory.read(VariableClass.INPUT, HvacSignals.ROOM_TEMPERATURE));
        assertArrayEquals(new int[] { 0, 0 }, table.read(200, 2));
    }

    @Test
    void outputsAreWrittenToActuators() throws InterruptedException {
        bridge.readPlantInputs(memory);
        memory.store(VariableClass.OUTPUT, HvacSignals.FAN_SPEED, Value.ofInt(60));
        memory.store(VariableClass.OUTPUT, HvacSignals.CHILLER_ON, BoolValue.TRUE);

        assertTrue(bridge.writePlantOutputs(memory));

        assertEquals(300, fake.lastWrite().address());
        assertArrayEquals(new int[] { 60, 1 }, fake.lastWrite().values());
    }

    @Test
    void outputsAreSkippedWithoutConnection() {
        assertFalse(bridge.writePlantOutputs(memory));

        assertEquals(0, fake.connectAttempts());
        assertTrue(fake.writes().isEmpty());
    }

    @Test
    void failedWriteDropsConnection() throws InterruptedException {
        bridge.readPlantInputs(memory);
        fake.failWrites(true);

        assertFalse(bridge.writePlantOutputs(memory));
        assertFalse(bridge.isPlantConnected());
    }

    @Test
    void statusBlockIsPublished() {
        memory.store(VariableClass.INPUT, HvacSignals.ROOM_TEMPERATURE, Value.ofReal(25.0));
        memory.store(VariableClass.INPUT, HvacSignals.ROOM_HUMIDITY, Value.ofReal(48.5));
        memory.store(VariableClass.OUTPUT, HvacSignals.FAN_SPEED, Value.ofInt(60));
        memory.store(VariableClass.OUTPUT, HvacSignals.CHILLER_ON, BoolValue.TRUE);
        memory.store(VariableClass.OUTPUT, HvacSignals.SYSTEM_STATUS, Value.ofInt(HvacSignals.STATUS_COOLING));

        bridge.publishStatus(memory);

        assertArrayEquals(new int[] { 250, 485, 60, 1, 1, 0 }, table.read(100, 6));
        assertArrayEquals(new int[] { 60, 1 }, table.read(300, 2));
    }

    @Test
    void statusPublishKeepsWordsForNamesNotInMemory() {
        table.write(100, new int[] { 111, 222, 33, 0, 2, 1 });
        PlcMemory sparse = new PlcMemory();
        sparse.store(VariableClass.OUTPUT, HvacSignals.FAN_SPEED, Value.ofInt(75));

        bridge.publishStatus(sparse);

        assertArrayEquals(new int[] { 111, 222, 75, 0, 2, 1 }, table.read(100, 6));
    }
}
