package com.questrail.plc.runtime;

import com.questrail.plc.config.PlcRuntimeConfig;
import com.questrail.plc.observability.Slf4jPlcObservabilitySink;
import com.questrail.plc.protocol.modbus.client.ModbusTransportException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point. Configuration comes from the environment
 * (see {@link PlcRuntimeConfig#fromEnvironment}).
 */
public final class PlcMain
{
    private static final Logger log = LoggerFactory.getLogger(PlcMain.class);

    private PlcMain() {}

    public static void main(String[] args) throws InterruptedException
    {
        log.info("Starting PLC Simulator");

        PlcRuntimeConfig config;
        try {
            config = PlcRuntimeConfig.fromEnvironment(System.getenv());
        }
        catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        PlcRuntime runtime = PlcRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(new Slf4jPlcObservabilitySink())
                .build();

        Runtime.getRuntime().addShutdownHook(new Thread(runtime::stop, "plc-shutdown"));

        try {
            runtime.start();
        }
        catch (ModbusTransportException e) {
            log.error("Fatal error: {}", e.getMessage(), e);
            runtime.stop();
            System.exit(1);
            return;
        }

        runtime.awaitTermination();
    }
}
