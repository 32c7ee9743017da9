package com.questrail.plc.core.exec;

import com.questrail.plc.core.EvaluationError;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one {@link PlcInterpreter#executeCycle()} call.
 *
 * @param cycleNumber   1-based count of executed cycles
 * @param mode          whether the loaded program or the default controller ran
 * @param systemEnabled the enable flag snapshotted before execution
 * @param error         the error that ended the cycle early, if any
 * @param duration      time spent executing logic
 */
public record CycleReport(
        long cycleNumber,
        Mode mode,
        boolean systemEnabled,
        Optional<EvaluationError> error,
        Duration duration
) {
    public enum Mode
    {
        PROGRAM,
        DEFAULT_CONTROLLER
    }

    public CycleReport {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(duration, "duration");
    }

    public boolean succeeded() {
        return error.isEmpty();
    }
}
