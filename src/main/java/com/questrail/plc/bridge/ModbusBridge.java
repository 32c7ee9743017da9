package com.questrail.plc.bridge;

import com.questrail.plc.api.Value;
import com.questrail.plc.api.VariableClass;
import com.questrail.plc.core.HvacSignals;
import com.questrail.plc.core.PlcMemory;
import com.questrail.plc.mapping.RegisterBlock;
import com.questrail.plc.mapping.RegisterCodec;
import com.questrail.plc.mapping.RegisterMap;
import com.questrail.plc.mapping.RegisterSignal;
import com.questrail.plc.protocol.modbus.client.ModbusClient;
import com.questrail.plc.protocol.modbus.client.ModbusTransportException;
import com.questrail.plc.protocol.modbus.server.RegisterTable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ModbusBridge
 * =============================================================================
 * Moves process data between {@link PlcMemory}, the plant, and the register
 * table served to the supervisory system.
 *
 * <h2>Per-cycle operations</h2>
 * <ol>
 *   <li>{@link #pullCommands(PlcMemory)}: command block → inputs</li>
 *   <li>{@link #readPlantInputs(PlcMemory)}: plant sensors → inputs, mirrored
 *       into the status and sensor blocks</li>
 *   <li>{@link #writePlantOutputs(PlcMemory)}: outputs → plant actuators</li>
 *   <li>{@link #publishStatus(PlcMemory)}: memory → status and actuator blocks</li>
 * </ol>
 *
 * <p>Only names that memory already holds as inputs (or does not hold at
 * all) are written as inputs, converted to the type already held. A program
 * that declares, say, {@code SetpointTemp} as an output keeps control of it.</p>
 *
 * <p>Plant failures never propagate: the client is dropped and the operation
 * reports {@code false}.</p>
 */
public final class ModbusBridge implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(ModbusBridge.class);

    /** Raw startup words for the command block, addresses 0..4. */
    static final int[] COMMAND_DEFAULTS = { 0, 220, 450, 10, 50 };

    private static final List<RegisterSignal> STATUS_SIGNALS = RegisterMap.signalsIn(RegisterBlock.STATUS);

    private final RegisterTable table;
    private final PlantConnection plant;

    public ModbusBridge(RegisterTable table, PlantConnection plant)
    {
        this.table = Objects.requireNonNull(table, "table");
        this.plant = Objects.requireNonNull(plant, "plant");
    }

    /**
     * Seeds the command block with the startup setpoints (22.0 °C, 45.0 %,
     * deadbands 1.0 and 5.0) and the system disabled.
     */
    public void initializeCommandDefaults()
    {
        table.write(RegisterSignal.SYSTEM_ENABLE.address(), COMMAND_DEFAULTS);
        log.info("Initialized command registers with default setpoints");
    }

    /**
     * Copies the supervisory command block into the input area.
     */
    public void pullCommands(PlcMemory memory)
    {
        Objects.requireNonNull(memory, "memory");

        List<RegisterSignal> commands = RegisterMap.signalsIn(RegisterBlock.COMMANDS);
        int first = commands.get(0).address();
        int[] words = table.read(first, commands.size());

        for (RegisterSignal s : commands) {
            storeInput(memory, s.label(), RegisterCodec.decode(words[s.address() - first], s.encoding()));
        }
    }

    /**
     * Reads the two sensor registers from the plant.
     *
     * @return true if the plant answered
     * @throws InterruptedException if interrupted during the plant startup delay
     */
    public boolean readPlantInputs(PlcMemory memory) throws InterruptedException
    {
        Objects.requireNonNull(memory, "memory");

        Optional<ModbusClient> client = plant.acquire();
        if (client.isEmpty()) {
            return false;
        }

        int[] words;
        try {
            words = client.get().readHoldingRegisters(RegisterSignal.SENSOR_TEMP.address(), 2);
        }
        catch (ModbusTransportException e) {
            log.error("Error reading from physical model: {}", e.getMessage());
            plant.drop(e);
            return false;
        }

        Value temperature = RegisterCodec.decode(words[0], RegisterSignal.SENSOR_TEMP.encoding());
        Value humidity = RegisterCodec.decode(words[1], RegisterSignal.SENSOR_HUMIDITY.encoding());
        storeInput(memory, HvacSignals.ROOM_TEMPERATURE, temperature);
        storeInput(memory, HvacSignals.ROOM_HUMIDITY, humidity);

        table.write(RegisterSignal.SENSOR_TEMP.address(), words);
        table.write(RegisterSignal.ROOM_TEMPERATURE.address(), words);
        return true;
    }

    /**
     * Writes fan speed and chiller state to the plant. Only uses a connection
     * that is already up; never connects.
     *
     * @return true if the plant acknowledged the write
     */
    public boolean writePlantOutputs(PlcMemory memory)
    {
        Objects.requireNonNull(memory, "memory");

        Optional<ModbusClient> client = plant.current();
        if (client.isEmpty()) {
            return false;
        }

        int[] words = actuatorWords(memory);
        try {
            client.get().writeMultipleRegisters(RegisterSignal.ACTUATOR_FAN_SPEED.address(), words);
        }
        catch (ModbusTransportException e) {
            log.error("Error writing to physical model: {}", e.getMessage());
            plant.drop(e);
            return false;
        }
        return true;
    }

    /**
     * Publishes the status block and mirrors the actuator block. The status
     * block is written in one atomic table operation.
     */
    public void publishStatus(PlcMemory memory)
    {
        Objects.requireNonNull(memory, "memory");

        int first = STATUS_SIGNALS.get(0).address();
        int[] words = table.read(first, STATUS_SIGNALS.size());
        for (RegisterSignal s : STATUS_SIGNALS) {
            Optional<Value> v = memory.read(s.label());
            if (v.isPresent()) {
                words[s.address() - first] = RegisterCodec.encode(v.get(), s.encoding());
            }
        }
        table.write(first, words);
        table.write(RegisterSignal.ACTUATOR_FAN_SPEED.address(), actuatorWords(memory));
    }

    public boolean isPlantConnected()
    {
        return plant.isConnected();
    }

    @Override
    public void close()
    {
        plant.close();
    }

    private static int[] actuatorWords(PlcMemory memory)
    {
        int fan = memory.read(HvacSignals.FAN_SPEED)
                .map(v -> RegisterCodec.encode(v, RegisterSignal.ACTUATOR_FAN_SPEED.encoding()))
                .orElse(0);
        int chiller = memory.read(HvacSignals.CHILLER_ON)
                .map(v -> RegisterCodec.encode(v, RegisterSignal.ACTUATOR_CHILLER.encoding()))
                .orElse(0);
        return new int[] { fan, chiller };
    }

    private static void storeInput(PlcMemory memory, String name, Value value)
    {
        if (memory.canStore(VariableClass.INPUT, name)) {
            Value typed = memory.read(VariableClass.INPUT, name)
                    .map(existing -> value.coerceTo(existing.type()))
                    .orElse(value);
            memory.store(VariableClass.INPUT, name, typed);
        }
        else {
            log.debug("Not overwriting {} {} from registers", memory.classOf(name).orElseThrow(), name);
        }
    }
}
