package com.questrail.plc.runtime;

import com.questrail.plc.config.PlcRuntimeConfig;
import com.questrail.plc.config.ScanTimingPolicy;
import com.questrail.plc.core.HvacSignals;
import com.questrail.plc.observability.CycleCompletedEvent;
import com.questrail.plc.observability.RecordingObservabilitySink;
import com.questrail.plc.protocol.modbus.client.FakeModbusClient;
import com.questrail.plc.protocol.modbus.client.ModbusClient;
import com.questrail.plc.protocol.modbus.transport.tcp.netty.NettyModbusTcpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end smoke test: a real Modbus server on an ephemeral port, the
 * bundled HVAC program, and a fake plant.
 */
final class PlcRuntimeSmokeTest {

    @TempDir
    Path dir;

    private PlcRuntime runtime;

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.stop();
        }
    }

    private PlcRuntimeConfig config(Path program) {
        return PlcRuntimeConfig.builder()
                .withProgramPath(program)
                .withServerBindAddress(new InetSocketAddress("127.0.0.1", 0))
                .withTimingPolicy(ScanTimingPolicy.defaults()
                        .withScanPeriod(Duration.ofMillis(20))
                        .withPlantStartupDelay(Duration.ZERO))
                .build();
    }

    private Path bundledProgram() throws IOException {
        Path file = dir.resolve("hvac_control.st");
        try (InputStream in = getClass().getResourceAsStream("/plc_programs/hvac_control.st")) {
            assertNotNull(in, "bundled program missing from classpath");
            Files.copy(in, file);
        }
        return file;
    }

    private static void awaitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void supervisoryClientDrivesTheBundledProgram() throws Exception {
        FakeModbusClient plant = new FakeModbusClient();
        plant.setSensors(250, 500);
        RecordingObservabilitySink sink = new RecordingObservabilitySink();

        runtime = PlcRuntime.builder()
                .withConfig(config(bundledProgram()))
                .withObservabilitySink(sink)
                .withPlantClientFactory(plant.factory())
                .build();
        runtime.start();

        assertTrue(runtime.scanState().programLoaded());
        InetSocketAddress address = runtime.serverAddress().orElseThrow();

        try (ModbusClient scada = new NettyModbusTcpClient(address, 1, Duration.ofSeconds(2))) {
            scada.connect();
            assertArrayEquals(new int[] { 0, 220, 450, 10, 50 }, scada.readHoldingRegisters(0, 5));

            scada.writeSingleRegister(0, 1);
            awaitUntil(() -> runtime.context().registers().read(104) == HvacSignals.STATUS_COOLING);

            int[] status = scada.readHoldingRegisters(100, 6);
            assertEquals(250, status[0]);
            assertEquals(60, status[2]);
            assertEquals(1, status[3]);
            assertEquals(0, status[5]);
        }

        awaitUntil(() -> plant.plant().read(300) == 60);
        assertTrue(runtime.scanState().running());
        assertTrue(sink.hasEventOfType(CycleCompletedEvent.class));

        runtime.stop();
        runtime.awaitTermination();
        assertFalse(runtime.scanState().running());
    }

    @Test
    void missingProgramFallsBackToDefaultController() throws Exception {
        FakeModbusClient plant = new FakeModbusClient();
        plant.setSensors(250, 500);

        runtime = PlcRuntime.builder()
                .withConfig(config(dir.resolve("missing.st")))
                .withPlantClientFactory(plant.factory())
                .build();
        runtime.start();

        assertFalse(runtime.scanState().programLoaded());
        runtime.context().registers().write(0, 1);
        awaitUntil(() -> runtime.context().registers().read(102) == 60);
    }
}
