package com.questrail.plc.runtime;

import com.questrail.plc.bridge.ModbusBridge;
import com.questrail.plc.bridge.PlantConnection;
import com.questrail.plc.config.PlcRuntimeConfig;
import com.questrail.plc.core.exec.BuiltinRegistry;
import com.questrail.plc.core.exec.PlcInterpreter;
import com.questrail.plc.lang.ast.Program;
import com.questrail.plc.mapping.RegisterMap;
import com.questrail.plc.observability.NullObservabilitySink;
import com.questrail.plc.observability.PlcObservabilitySink;
import com.questrail.plc.protocol.modbus.client.ModbusClientFactory;
import com.questrail.plc.protocol.modbus.client.ModbusTransportException;
import com.questrail.plc.protocol.modbus.server.ModbusRequestProcessor;
import com.questrail.plc.protocol.modbus.server.RegisterTable;
import com.questrail.plc.protocol.modbus.transport.ModbusServerEndpoint;
import com.questrail.plc.protocol.modbus.transport.tcp.netty.NettyModbusClientFactory;
import com.questrail.plc.protocol.modbus.transport.tcp.netty.NettyModbusTcpServer;
import com.questrail.plc.time.MonotonicClock;
import com.questrail.plc.time.Sleeper;
import com.questrail.plc.time.SystemMonotonicClock;
import com.questrail.plc.time.ThreadSleeper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PlcRuntime
 * =============================================================================
 * Unified composition root and lifecycle owner for one PLC instance: program,
 * interpreter, register table, Modbus server, plant link and scan loop.
 */
public final class PlcRuntime {
    private static final Logger log = LoggerFactory.getLogger(PlcRuntime.class);

    private final PlcContext context;
    private final ScanCycleScheduler scheduler;
    private final ModbusServerEndpoint server;

    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private PlcRuntime(PlcContext context, ScanCycleScheduler scheduler, ModbusServerEndpoint server) {
        this.context = context;
        this.scheduler = scheduler;
        this.server = server;
    }

    /**
     * Seeds the command registers, binds the Modbus server, and starts scanning.
     *
     * @throws ModbusTransportException if the server cannot bind
     */
    public void start() throws ModbusTransportException {
        context.bridge().initializeCommandDefaults();
        server.start();
        scheduler.start();
        log.info("PLC runtime started ({})",
            context.interpreter().isProgramLoaded() ? "ST program" : "default controller");
    }

    /**
     * Stops the scan loop, then closes the plant link and the server.
     * Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping PLC runtime");
        scheduler.stop();
        context.bridge().close();
        server.close();
        terminated.countDown();
    }

    /**
     * Blocks until {@link #stop()} has completed.
     */
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public ScanState scanState() {
        return context.scanState();
    }

    public PlcContext context() {
        return context;
    }

    public Optional<InetSocketAddress> serverAddress() {
        return server.boundAddress();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private PlcRuntimeConfig config = PlcRuntimeConfig.builder().build();
        private PlcObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private BuiltinRegistry builtins = BuiltinRegistry.standard();
        private ProgramLoader programLoader = new ProgramLoader();
        private ModbusClientFactory plantClientFactory;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private Sleeper sleeper = ThreadSleeper.INSTANCE;

        public Builder withConfig(PlcRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(PlcObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withBuiltins(BuiltinRegistry builtins) {
            this.builtins = builtins;
            return this;
        }

        public Builder withProgramLoader(ProgramLoader loader) {
            this.programLoader = loader;
            return this;
        }

        /**
         * Overrides how plant clients are created. Defaults to Netty clients
         * for {@code config.plantAddress()}.
         */
        public Builder withPlantClientFactory(ModbusClientFactory factory) {
            this.plantClientFactory = factory;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withSleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public PlcRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(builtins, "builtins");
            Objects.requireNonNull(programLoader, "programLoader");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(sleeper, "sleeper");

            // 1. Program and interpreter
            Optional<Program> program = programLoader.load(config.programPath());
            PlcInterpreter interpreter = program
                .map(p -> PlcInterpreter.forProgram(p, builtins, clock))
                .orElseGet(() -> PlcInterpreter.withDefaultController(clock));

            // 2. Register table and supervisory server
            RegisterTable registers = new RegisterTable(RegisterMap.REGISTER_COUNT);
            ModbusServerEndpoint server = new NettyModbusTcpServer(
                config.serverBindAddress(),
                new ModbusRequestProcessor(registers)
            );

            // 3. Plant link and bridge
            ModbusClientFactory factory = plantClientFactory != null
                ? plantClientFactory
                : new NettyModbusClientFactory(
                    config.plantAddress(), config.plantUnitId(), config.timingPolicy().plantIoTimeout());
            PlantConnection plant = new PlantConnection(
                factory,
                config.plantAddress().getHostString() + ":" + config.plantAddress().getPort(),
                config.timingPolicy().plantStartupDelay(),
                sleeper,
                observabilitySink
            );
            ModbusBridge bridge = new ModbusBridge(registers, plant);

            // 4. Context and scan loop
            PlcContext context = new PlcContext(interpreter, bridge, registers);
            ScanCycleScheduler scheduler = new ScanCycleScheduler(
                context, config.timingPolicy(), clock, sleeper, observabilitySink);

            return new PlcRuntime(context, scheduler, server);
        }
    }
}
