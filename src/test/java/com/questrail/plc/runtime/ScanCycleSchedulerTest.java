package com.questrail.plc.runtime;

import com.questrail.plc.api.BoolValue;
import com.questrail.plc.api.Value;
import com.questrail.plc.api.VariableClass;
import com.questrail.plc.bridge.ModbusBridge;
import com.questrail.plc.bridge.PlantConnection;
import com.questrail.plc.config.ScanTimingPolicy;
import com.questrail.plc.core.HvacSignals;
import com.questrail.plc.core.exec.BuiltinRegistry;
import com.questrail.plc.core.exec.CycleReport;
import com.questrail.plc.core.exec.Evaluation;
import com.questrail.plc.core.exec.PlcInterpreter;
import com.questrail.plc.lang.StParseException;
import com.questrail.plc.lang.StParser;
import com.questrail.plc.mapping.RegisterMap;
import com.questrail.plc.observability.CycleCompletedEvent;
import com.questrail.plc.observability.CycleOverrunEvent;
import com.questrail.plc.observability.PlantLinkEvent;
import com.questrail.plc.observability.PlcErrorEvent;
import com.questrail.plc.observability.PlcObservabilitySink;
import com.questrail.plc.observability.RecordingObservabilitySink;
import com.questrail.plc.protocol.modbus.client.FakeModbusClient;
import com.questrail.plc.protocol.modbus.server.RegisterTable;
import com.questrail.plc.time.ManualMonotonicClock;
import com.questrail.plc.time.RecordingSleeper;
import com.questrail.plc.time.Sleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScanCycleSchedulerTest
 * -----------------------------------------------------------------------------
 * Drives the scan loop with a manual clock. Pacing sleeps advance the clock
 * and yield briefly so the loop thread never spins.
 */
class ScanCycleSchedulerTest {

    private static final ScanTimingPolicy POLICY = ScanTimingPolicy.defaults()
            .withPlantStartupDelay(Duration.ZERO);

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final RecordingSleeper recording = new RecordingSleeper(clock);
    private final Sleeper pacing = d -> {
        recording.sleep(d);
        Thread.sleep(1);
    };
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final FakeModbusClient fake = new FakeModbusClient();

    private ScanCycleScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    private PlcContext context(PlcInterpreter interpreter, RegisterTable table) {
        PlantConnection plant = new PlantConnection(fake.factory(), "plant", Duration.ZERO, pacing, sink);
        ModbusBridge bridge = new ModbusBridge(table, plant);
        bridge.initializeCommandDefaults();
        return new PlcContext(interpreter, bridge, table);
    }

    private PlcContext defaultContext() {
        return context(PlcInterpreter.withDefaultController(clock), new RegisterTable(RegisterMap.REGISTER_COUNT));
    }

    private static void awaitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(5);
        }
    }

    @Test
    void runOnceMovesDataThroughAllStages() throws InterruptedException {
        PlcContext ctx = defaultContext();
        scheduler = new ScanCycleScheduler(ctx, POLICY, clock, pacing, sink);
        ctx.registers().write(0, 1);
        fake.setSensors(250, 500);

        CycleReport report = scheduler.runOnce();

        assertTrue(report.succeeded());
        assertTrue(report.systemEnabled());
        assertEquals(Optional.of(Value.ofInt(60)),
                ctx.interpreter().memory().read(VariableClass.OUTPUT, HvacSignals.FAN_SPEED));
        assertArrayEquals(new int[] { 250, 500, 60, 1, HvacSignals.STATUS_COOLING, 0 }, ctx.registers().read(100, 6));
        assertArrayEquals(new int[] { 60, 1 }, fake.plant().read(300, 2));

        ScanState state = ctx.scanState();
        assertEquals(1, state.cycleCount());
        assertTrue(state.systemEnabled());
        assertFalse(state.programLoaded());
        assertTrue(sink.hasEventOfType(CycleCompletedEvent.class));
        assertTrue(sink.eventsOfType(CycleCompletedEvent.class).get(0).plantConnected());
    }

    @Test
    void supervisoryWriteIsSeenOnTheNextCycle() throws InterruptedException {
        PlcContext ctx = defaultContext();
        scheduler = new ScanCycleScheduler(ctx, POLICY, clock, pacing, sink);
        fake.setSensors(250, 500);

        scheduler.runOnce();
        assertEquals(HvacSignals.STATUS_OFF, ctx.registers().read(104));

        ctx.registers().write(0, 1);
        scheduler.runOnce();
        assertEquals(HvacSignals.STATUS_COOLING, ctx.registers().read(104));

        ctx.registers().write(1, 260);
        scheduler.runOnce();
        assertEquals(HvacSignals.STATUS_IDLE, ctx.registers().read(104));
        assertEquals(20, ctx.registers().read(102));
    }

    @Test
    void logicStillRunsWithoutPlant() throws InterruptedException {
        fake.refuseConnect(true);
        PlcContext ctx = defaultContext();
        scheduler = new ScanCycleScheduler(ctx, POLICY, clock, pacing, sink);
        ctx.registers().write(0, 1);

        CycleReport report = scheduler.runOnce();

        assertTrue(report.succeeded());
        assertEquals(HvacSignals.STATUS_IDLE, ctx.registers().read(104));
        assertFalse(sink.eventsOfType(CycleCompletedEvent.class).get(0).plantConnected());
    }

    @Test
    void loopPacesToTheScanPeriod() throws InterruptedException {
        scheduler = new ScanCycleScheduler(defaultContext(), POLICY, clock, pacing, sink);

        scheduler.start();
        assertTrue(scheduler.isRunning());
        awaitUntil(() -> sink.eventsOfType(CycleCompletedEvent.class).size() >= 3);
        scheduler.stop();

        List<Duration> sleeps = recording.sleeps();
        assertFalse(sleeps.isEmpty());
        assertEquals(Duration.ofMillis(100), sleeps.get(0));
        assertFalse(sink.hasEventOfType(CycleOverrunEvent.class));
        assertFalse(scheduler.isRunning());
    }

    @Test
    void overrunIsReportedAndNextCycleStartsWithoutSleeping() throws InterruptedException, StParseException {
        BuiltinRegistry builtins = BuiltinRegistry.standard().register("SLOW", (name, args) -> {
            clock.advanceMillis(150);
            return Evaluation.ok(BoolValue.TRUE);
        });
        PlcInterpreter interpreter = PlcInterpreter.forProgram(
                new StParser().parse("PROGRAM Slow VAR x : INT; END_VAR SLOW(); x := x + 1; END_PROGRAM"),
                builtins, clock);
        scheduler = new ScanCycleScheduler(
                context(interpreter, new RegisterTable(RegisterMap.REGISTER_COUNT)), POLICY, clock, pacing, sink);

        scheduler.start();
        awaitUntil(() -> sink.eventsOfType(CycleOverrunEvent.class).size() >= 2);
        scheduler.stop();

        CycleOverrunEvent overrun = sink.eventsOfType(CycleOverrunEvent.class).get(0);
        assertEquals(Duration.ofMillis(150), overrun.elapsed());
        assertEquals(Duration.ofMillis(50), overrun.overrunBy());
        assertTrue(recording.sleeps().isEmpty());
    }

    @Test
    void failedIterationIsReportedAndLoopPausesOnePeriod() throws InterruptedException {
        // Too small for the sensor block, so mirroring plant data fails.
        PlcContext ctx = context(PlcInterpreter.withDefaultController(clock), new RegisterTable(150));
        scheduler = new ScanCycleScheduler(ctx, POLICY, clock, pacing, sink);

        scheduler.start();
        awaitUntil(() -> sink.eventsOfType(PlcErrorEvent.class).size() >= 2);
        scheduler.stop();

        PlcErrorEvent error = sink.eventsOfType(PlcErrorEvent.class).get(0);
        assertEquals("Error in PLC cycle", error.message());
        assertInstanceOf(IndexOutOfBoundsException.class, error.cause());
        assertEquals(Duration.ofMillis(100), recording.sleeps().get(0));
    }

    @Test
    void startAndStopAreIdempotent() {
        PlcContext ctx = defaultContext();
        scheduler = new ScanCycleScheduler(ctx, POLICY, clock, pacing, sink);

        scheduler.start();
        scheduler.start();
        assertTrue(ctx.scanState().running());

        scheduler.stop();
        scheduler.stop();
        assertFalse(ctx.scanState().running());
    }

    @Test
    void stackOverflowIsCaughtAtTheIterationBoundary() throws InterruptedException {
        AtomicBoolean overflowed = new AtomicBoolean();
        PlcObservabilitySink overflowingSink = new PlcObservabilitySink() {
            @Override
            public void onCycleCompleted(CycleCompletedEvent event) {
                if (overflowed.compareAndSet(false, true)) {
                    throw new StackOverflowError();
                }
                sink.onCycleCompleted(event);
            }

            @Override
            public void onCycleOverrun(CycleOverrunEvent event) {
                sink.onCycleOverrun(event);
            }

            @Override
            public void onPlantLinkEvent(PlantLinkEvent event) {
                sink.onPlantLinkEvent(event);
            }

            @Override
            public void onError(PlcErrorEvent event) {
                sink.onError(event);
            }
        };
        scheduler = new ScanCycleScheduler(defaultContext(), POLICY, clock, pacing, overflowingSink);

        scheduler.start();
        awaitUntil(() -> sink.eventsOfType(CycleCompletedEvent.class).size() >= 2);
        assertTrue(scheduler.isRunning());
        scheduler.stop();

        PlcErrorEvent error = sink.eventsOfType(PlcErrorEvent.class).get(0);
        assertInstanceOf(StackOverflowError.class, error.cause());
        assertEquals(Duration.ofMillis(100), recording.sleeps().get(0));
    }
}
