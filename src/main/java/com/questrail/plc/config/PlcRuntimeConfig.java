package com.questrail.plc.config;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated configuration for the PLC runtime.
 *
 * <p>{@code plantAddress} is normally unresolved; the host name is looked up
 * each time the plant link connects.</p>
 */
public record PlcRuntimeConfig(
    Path programPath,
    InetSocketAddress serverBindAddress,
    InetSocketAddress plantAddress,
    int plantUnitId,
    ScanTimingPolicy timingPolicy
) {
    public static final String ENV_PROGRAM_PATH = "PLC_PROGRAM_PATH";
    public static final String ENV_MODBUS_PORT = "PLC_MODBUS_PORT";
    public static final String ENV_PLANT_HOST = "PHYSICAL_MODEL_HOST";
    public static final String ENV_PLANT_PORT = "PHYSICAL_MODEL_PORT";
    public static final String ENV_SCAN_PERIOD_MS = "PLC_SCAN_PERIOD_MS";

    public static final Path DEFAULT_PROGRAM_PATH = Path.of("/app/plc_programs/hvac_control.st");
    public static final int DEFAULT_MODBUS_PORT = 502;
    public static final String DEFAULT_PLANT_HOST = "physical-model";
    public static final int DEFAULT_PLANT_PORT = 503;
    public static final int DEFAULT_UNIT_ID = 1;

    public PlcRuntimeConfig {
        Objects.requireNonNull(programPath, "programPath");
        Objects.requireNonNull(serverBindAddress, "serverBindAddress");
        Objects.requireNonNull(plantAddress, "plantAddress");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        if (plantUnitId < 0 || plantUnitId > 0xFF) {
            throw new IllegalArgumentException("plantUnitId must be in 0..255: " + plantUnitId);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a configuration from environment-style variables. Anything absent
     * keeps its default.
     *
     * @throws IllegalArgumentException if a numeric variable is not a number or out of range
     */
    public static PlcRuntimeConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");

        Builder b = builder();
        String program = env.get(ENV_PROGRAM_PATH);
        if (program != null && !program.isBlank()) {
            b.withProgramPath(Path.of(program.trim()));
        }

        int serverPort = port(env, ENV_MODBUS_PORT, DEFAULT_MODBUS_PORT);
        b.withServerBindAddress(new InetSocketAddress(serverPort));

        String host = env.getOrDefault(ENV_PLANT_HOST, DEFAULT_PLANT_HOST).trim();
        int plantPort = port(env, ENV_PLANT_PORT, DEFAULT_PLANT_PORT);
        b.withPlantAddress(InetSocketAddress.createUnresolved(host, plantPort));

        String period = env.get(ENV_SCAN_PERIOD_MS);
        if (period != null && !period.isBlank()) {
            long millis = parse(ENV_SCAN_PERIOD_MS, period);
            b.withTimingPolicy(ScanTimingPolicy.defaults().withScanPeriod(Duration.ofMillis(millis)));
        }
        return b.build();
    }

    private static int port(Map<String, String> env, String name, int fallback) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        long port = parse(name, raw);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(name + " out of range: " + port);
        }
        return (int) port;
    }

    private static long parse(String name, String raw) {
        try {
            return Long.parseLong(raw.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: '" + raw + "'", e);
        }
    }

    public static final class Builder {
        private Path programPath = DEFAULT_PROGRAM_PATH;
        private InetSocketAddress serverBindAddress = new InetSocketAddress(DEFAULT_MODBUS_PORT);
        private InetSocketAddress plantAddress =
            InetSocketAddress.createUnresolved(DEFAULT_PLANT_HOST, DEFAULT_PLANT_PORT);
        private int plantUnitId = DEFAULT_UNIT_ID;
        private ScanTimingPolicy timingPolicy = ScanTimingPolicy.defaults();

        public Builder withProgramPath(Path programPath) {
            this.programPath = programPath;
            return this;
        }

        public Builder withServerBindAddress(InetSocketAddress serverBindAddress) {
            this.serverBindAddress = serverBindAddress;
            return this;
        }

        public Builder withPlantAddress(InetSocketAddress plantAddress) {
            this.plantAddress = plantAddress;
            return this;
        }

        public Builder withPlantUnitId(int plantUnitId) {
            this.plantUnitId = plantUnitId;
            return this;
        }

        public Builder withTimingPolicy(ScanTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public PlcRuntimeConfig build() {
            return new PlcRuntimeConfig(programPath, serverBindAddress, plantAddress, plantUnitId, timingPolicy);
        }
    }
}
