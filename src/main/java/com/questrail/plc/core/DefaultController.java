package com.questrail.plc.core;

import com.questrail.plc.api.BoolValue;
import com.questrail.plc.api.Value;
import com.questrail.plc.api.VariableClass;

import java.util.Objects;
import java.util.Optional;

import static com.questrail.plc.core.HvacSignals.*;

/**
 * DefaultController
 * =============================================================================
 * Hard-wired deadband controller used whenever no valid program is loaded.
 *
 * <pre>
 *   disabled                       → FanSpeed 0,  chiller off, status OFF
 *   temp error  > TempDeadband     → chiller on,  status COOLING,
 *                                    FanSpeed = clamp(30, 100, round(tempError * 20))
 *   humidity error > HumidityDeadband only
 *                                  → chiller on,  status COOLING, FanSpeed 50
 *   otherwise                      → chiller off, status IDLE,    FanSpeed 20
 * </pre>
 *
 * <p>The computed errors and demand flags are also written to internal memory
 * so they can be inspected alongside the outputs.</p>
 */
public final class DefaultController
{
    static final int MIN_COOLING_FAN = 30;
    static final int MAX_FAN = 100;
    static final int DEHUMIDIFY_FAN = 50;
    static final int IDLE_FAN = 20;
    static final double FAN_GAIN = 20.0;

    /**
     * Runs one cycle of the deadband rule over the given memory.
     *
     * @param memory        working memory; inputs are read, outputs/internals written
     * @param systemEnabled enable flag snapshotted at the start of the cycle
     * @return an error if a required input is missing or not numeric
     */
    public Optional<EvaluationError> execute(PlcMemory memory, boolean systemEnabled) {
        Objects.requireNonNull(memory, "memory");

        if (!systemEnabled) {
            memory.store(VariableClass.OUTPUT, FAN_SPEED, Value.ofInt(0));
            memory.store(VariableClass.OUTPUT, CHILLER_ON, BoolValue.FALSE);
            memory.store(VariableClass.OUTPUT, SYSTEM_STATUS, Value.ofInt(STATUS_OFF));
            return Optional.empty();
        }

        double[] in = new double[6];
        String[] names = {
                ROOM_TEMPERATURE, SETPOINT_TEMP, ROOM_HUMIDITY, SETPOINT_HUMIDITY, TEMP_DEADBAND, HUMIDITY_DEADBAND
        };
        for (int i = 0; i < names.length; i++) {
            Optional<Value> v = memory.read(VariableClass.INPUT, names[i]);
            if (v.isEmpty()) {
                return Optional.of(EvaluationError.undefinedVariable(names[i]));
            }
            if (!v.get().isNumeric()) {
                return Optional.of(EvaluationError.typeMismatch("Input '" + names[i] + "' is not numeric"));
            }
            in[i] = v.get().asReal();
        }

        double tempError = in[0] - in[1];
        double humidityError = in[2] - in[3];
        boolean coolingRequired = tempError > in[4];
        boolean dehumidRequired = humidityError > in[5];

        memory.store(VariableClass.INTERNAL, TEMP_ERROR, Value.ofReal(tempError));
        memory.store(VariableClass.INTERNAL, HUMIDITY_ERROR, Value.ofReal(humidityError));
        memory.store(VariableClass.INTERNAL, COOLING_REQUIRED, BoolValue.of(coolingRequired));
        memory.store(VariableClass.INTERNAL, DEHUMID_REQUIRED, BoolValue.of(dehumidRequired));

        if (coolingRequired || dehumidRequired) {
            long fanSpeed = coolingRequired
                    ? clamp(MIN_COOLING_FAN, MAX_FAN, Math.round(tempError * FAN_GAIN))
                    : DEHUMIDIFY_FAN;
            memory.store(VariableClass.OUTPUT, CHILLER_ON, BoolValue.TRUE);
            memory.store(VariableClass.OUTPUT, SYSTEM_STATUS, Value.ofInt(STATUS_COOLING));
            memory.store(VariableClass.OUTPUT, FAN_SPEED, Value.ofInt(fanSpeed));
        } else {
            memory.store(VariableClass.OUTPUT, CHILLER_ON, BoolValue.FALSE);
            memory.store(VariableClass.OUTPUT, FAN_SPEED, Value.ofInt(IDLE_FAN));
            memory.store(VariableClass.OUTPUT, SYSTEM_STATUS, Value.ofInt(STATUS_IDLE));
        }
        return Optional.empty();
    }

    static long clamp(long lo, long hi, long v) {
        return Math.max(lo, Math.min(hi, v));
    }
}
