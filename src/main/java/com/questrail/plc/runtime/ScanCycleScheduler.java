package com.questrail.plc.runtime;

import com.questrail.plc.api.Value;
import com.questrail.plc.config.ScanTimingPolicy;
import com.questrail.plc.core.HvacSignals;
import com.questrail.plc.core.PlcMemory;
import com.questrail.plc.core.exec.CycleReport;
import com.questrail.plc.observability.CycleCompletedEvent;
import com.questrail.plc.observability.CycleOverrunEvent;
import com.questrail.plc.observability.NullObservabilitySink;
import com.questrail.plc.observability.PlcErrorEvent;
import com.questrail.plc.observability.PlcObservabilitySink;
import com.questrail.plc.time.MonotonicClock;
import com.questrail.plc.time.Sleeper;
import com.questrail.plc.time.SystemWallClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ScanCycleScheduler
 * =============================================================================
 * Runs the PLC scan loop on a dedicated thread at a fixed target period.
 *
 * <h2>One iteration</h2>
 * <ol>
 *   <li>pull the supervisory command block into memory inputs</li>
 *   <li>read plant sensors</li>
 *   <li>execute the program (or the default controller)</li>
 *   <li>write plant actuators</li>
 *   <li>publish status into the register table</li>
 * </ol>
 * followed by pacing: sleep for the rest of the period, or, if the iteration
 * overran, report it and start the next one immediately. Overruns are never
 * caught up.
 *
 * <h2>Failure handling</h2>
 * An exception escaping an iteration is reported to the observability sink
 * and the loop pauses one full period before trying again. The loop itself
 * only ends on {@link #stop()}.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   scheduler.start()    → starts the scan thread
 *   scheduler.runOnce()  → one unpaced iteration on the caller's thread (tests)
 *   scheduler.stop()     → interrupts pacing, waits for the thread to exit
 * </pre>
 * {@code runOnce()} must not be mixed with a started scheduler.
 */
public final class ScanCycleScheduler {
    private static final Logger log = LoggerFactory.getLogger(ScanCycleScheduler.class);

    private final PlcContext context;
    private final ScanTimingPolicy timingPolicy;
    private final MonotonicClock clock;
    private final Sleeper sleeper;
    private final PlcObservabilitySink observabilitySink;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread scanThread;

    public ScanCycleScheduler(PlcContext context,
                              ScanTimingPolicy timingPolicy,
                              MonotonicClock clock,
                              Sleeper sleeper,
                              PlcObservabilitySink observabilitySink)
    {
        this.context = Objects.requireNonNull(context, "context");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Starts the scan thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            context.updateScanState(context.scanState().withRunning(true));
            scanThread = new Thread(this::runLoop, "plc-scan-cycle");
            scanThread.start();
        }
    }

    /**
     * Stops the scan thread.
     * Blocks until the thread terminates or the shutdown timeout elapses.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread t = scanThread;
            if (t != null) {
                t.interrupt();
                try {
                    t.join(timingPolicy.shutdownTimeout().toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            context.updateScanState(context.scanState().withRunning(false));
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Executes exactly one iteration, without pacing.
     *
     * @return the interpreter's report for this iteration
     * @throws InterruptedException if interrupted while waiting for the plant
     */
    public CycleReport runOnce() throws InterruptedException {
        long start = clock.nowNanos();
        PlcMemory memory = context.interpreter().memory();

        context.bridge().pullCommands(memory);
        context.bridge().readPlantInputs(memory);
        CycleReport report = context.interpreter().executeCycle();
        context.bridge().writePlantOutputs(memory);
        context.bridge().publishStatus(memory);

        Duration elapsed = Duration.ofNanos(clock.nowNanos() - start);
        context.updateScanState(new ScanState(
            report.cycleNumber(),
            elapsed,
            report.systemEnabled(),
            running.get(),
            context.interpreter().isProgramLoaded(),
            memory.read(HvacSignals.ALARM_ACTIVE).map(Value::asBoolean).orElse(false)
        ));

        observabilitySink.onCycleCompleted(new CycleCompletedEvent(
            SystemWallClock.INSTANCE.now(),
            report,
            context.bridge().isPlantConnected()
        ));
        return report;
    }

    /**
     * Main scan loop - runs on the dedicated thread.
     */
    private void runLoop() {
        Duration period = timingPolicy.scanPeriod();

        while (running.get()) {
            long start = clock.nowNanos();
            try {
                runOnce();
            } catch (InterruptedException e) {
                // stop() interrupts; otherwise carry on with the next cycle
                log.debug("Scan cycle interrupted (running={})", running.get());
                continue;
            } catch (Exception | StackOverflowError e) {
                observabilitySink.onError(new PlcErrorEvent(
                    SystemWallClock.INSTANCE.now(),
                    "Error in PLC cycle",
                    e
                ));
                pause(period);
                continue;
            }

            Duration elapsed = Duration.ofNanos(clock.nowNanos() - start);
            if (elapsed.compareTo(period) < 0) {
                pause(period.minus(elapsed));
            } else if (elapsed.compareTo(period) > 0) {
                observabilitySink.onCycleOverrun(new CycleOverrunEvent(
                    SystemWallClock.INSTANCE.now(),
                    context.scanState().cycleCount(),
                    elapsed,
                    period
                ));
            }
        }
    }

    private void pause(Duration d) {
        try {
            sleeper.sleep(d);
        } catch (InterruptedException e) {
            if (running.get()) {
                log.debug("Scan pacing interrupted while running; continuing");
            }
        }
    }
}
