package com.questrail.plc.core.exec;

import com.questrail.plc.api.BoolValue;
import com.questrail.plc.api.VariableClass;
import com.questrail.plc.core.DefaultController;
import com.questrail.plc.core.EvaluationError;
import com.questrail.plc.core.HvacSignals;
import com.questrail.plc.core.PlcMemory;
import com.questrail.plc.lang.ast.Program;
import com.questrail.plc.time.MonotonicClock;
import com.questrail.plc.time.SystemMonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PlcInterpreter
 * =============================================================================
 * Runs one scan cycle of logic over the interpreter's {@link PlcMemory}.
 *
 * <h2>Per cycle</h2>
 * <ol>
 *   <li>Snapshot {@code SystemEnable} from input memory.</li>
 *   <li>Execute the program's statements top to bottom, or the
 *       {@link DefaultController} when no program is loaded.</li>
 *   <li>If anything fails, set {@code AlarmActive}, log, and stop this
 *       cycle's statements. Nothing propagates to the caller.</li>
 * </ol>
 *
 * <p>This is the single recovery point for evaluation errors. The next cycle
 * starts from the first statement again.</p>
 *
 * <p>The alarm latches: the interpreter sets it but never clears it. A program
 * may clear it by assigning {@code AlarmActive}.</p>
 *
 * <h2>Threading</h2>
 * Not thread-safe; owned by the scan task.
 */
public final class PlcInterpreter
{
    private static final Logger log = LoggerFactory.getLogger(PlcInterpreter.class);

    private final Optional<Program> program;
    private final PlcMemory memory;
    private final StatementExecutor executor;
    private final DefaultController defaultController;
    private final MonotonicClock clock;

    private long cycleCount;
    private Duration lastCycleDuration = Duration.ZERO;
    private boolean systemEnabled;

    private PlcInterpreter(Optional<Program> program, PlcMemory memory, BuiltinRegistry builtins, MonotonicClock clock) {
        this.program = program;
        this.memory = memory;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultController = new DefaultController();
        this.executor = new StatementExecutor(
                new ExpressionEvaluator(builtins),
                builtins,
                program.map(Program::variables).orElse(Map.of()));
    }

    /**
     * Interpreter for a parsed program; memory is initialized from its
     * declarations.
     */
    public static PlcInterpreter forProgram(Program program, BuiltinRegistry builtins, MonotonicClock clock) {
        Objects.requireNonNull(program, "program");
        Objects.requireNonNull(builtins, "builtins");
        PlcMemory memory = PlcMemory.forProgram(program);
        log.info("Initialized memory with {} inputs, {} outputs, {} internal vars",
                memory.snapshot(VariableClass.INPUT).size(),
                memory.snapshot(VariableClass.OUTPUT).size(),
                memory.snapshot(VariableClass.INTERNAL).size());
        return new PlcInterpreter(Optional.of(program), memory, builtins, clock);
    }

    /**
     * Interpreter running the built-in HVAC controller over default memory.
     */
    public static PlcInterpreter withDefaultController(MonotonicClock clock) {
        log.info("Initialized default HVAC memory");
        return new PlcInterpreter(Optional.empty(), PlcMemory.withHvacDefaults(), new BuiltinRegistry(), clock);
    }

    public static PlcInterpreter withDefaultController() {
        return withDefaultController(SystemMonotonicClock.INSTANCE);
    }

    /**
     * Executes one cycle. Never throws for program faults.
     */
    public CycleReport executeCycle() {
        long start = clock.nowNanos();
        cycleCount++;

        CycleReport.Mode mode = program.isPresent() ? CycleReport.Mode.PROGRAM : CycleReport.Mode.DEFAULT_CONTROLLER;
        Optional<EvaluationError> error;
        try {
            systemEnabled = memory.read(VariableClass.INPUT, HvacSignals.SYSTEM_ENABLE)
                    .map(v -> v.asBoolean())
                    .orElse(false);

            error = program.isPresent()
                    ? executor.execute(program.get().statements(), memory)
                    : defaultController.execute(memory, systemEnabled);
        } catch (RuntimeException | StackOverflowError e) {
            log.error("Unexpected failure in PLC cycle {}", cycleCount, e);
            error = Optional.of(new EvaluationError(EvaluationError.Kind.INTERNAL, String.valueOf(e.getMessage())));
        }

        error.ifPresent(this::raiseAlarm);

        lastCycleDuration = Duration.ofNanos(clock.nowNanos() - start);
        return new CycleReport(cycleCount, mode, systemEnabled, error, lastCycleDuration);
    }

    private void raiseAlarm(EvaluationError error) {
        log.error("Error in PLC cycle execution: {}", error);
        if (memory.canStore(VariableClass.OUTPUT, HvacSignals.ALARM_ACTIVE)) {
            memory.store(VariableClass.OUTPUT, HvacSignals.ALARM_ACTIVE, BoolValue.TRUE);
        } else {
            log.warn("{} is not an output in this program; alarm not raised in memory", HvacSignals.ALARM_ACTIVE);
        }
    }

    public PlcMemory memory() {
        return memory;
    }

    public Optional<Program> program() {
        return program;
    }

    public boolean isProgramLoaded() {
        return program.isPresent();
    }

    public long cycleCount() {
        return cycleCount;
    }

    public Duration lastCycleDuration() {
        return lastCycleDuration;
    }

    public boolean systemEnabled() {
        return systemEnabled;
    }
}
