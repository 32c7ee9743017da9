package com.questrail.plc.runtime;

import com.questrail.plc.bridge.ModbusBridge;
import com.questrail.plc.core.exec.PlcInterpreter;
import com.questrail.plc.protocol.modbus.server.RegisterTable;

import java.util.Objects;

/**
 * PlcContext
 * =============================================================================
 * Everything one PLC instance owns, constructed once by the composition root
 * and handed to the scan loop.
 *
 * <h2>Ownership</h2>
 * <ul>
 *   <li>{@link #interpreter()} and its memory: scan thread only</li>
 *   <li>{@link #bridge()}: scan thread only</li>
 *   <li>{@link #registers()}: shared with the Modbus server (internally locked)</li>
 *   <li>{@link #scanState()}: written by the scan thread, readable anywhere</li>
 * </ul>
 */
public final class PlcContext
{
    private final PlcInterpreter interpreter;
    private final ModbusBridge bridge;
    private final RegisterTable registers;

    private volatile ScanState scanState;

    public PlcContext(PlcInterpreter interpreter, ModbusBridge bridge, RegisterTable registers)
    {
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.registers = Objects.requireNonNull(registers, "registers");
        this.scanState = ScanState.initial(interpreter.isProgramLoaded());
    }

    public PlcInterpreter interpreter()
    {
        return interpreter;
    }

    public ModbusBridge bridge()
    {
        return bridge;
    }

    public RegisterTable registers()
    {
        return registers;
    }

    public ScanState scanState()
    {
        return scanState;
    }

    void updateScanState(ScanState state)
    {
        this.scanState = Objects.requireNonNull(state, "state");
    }
}
