package com.questrail.plc.bridge;

import com.questrail.plc.observability.PlantLinkEvent;
import com.questrail.plc.observability.PlcObservabilitySink;
import com.questrail.plc.protocol.modbus.client.ModbusClient;
import com.questrail.plc.protocol.modbus.client.ModbusClientFactory;
import com.questrail.plc.protocol.modbus.client.ModbusTransportException;
import com.questrail.plc.time.Sleeper;
import com.questrail.plc.time.SystemWallClock;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * PlantConnection
 * -----------------------------------------------------------------------------
 * Owns the Modbus client used to reach the plant and decides when to
 * (re)connect.
 *
 * <h2>Policy</h2>
 * <ul>
 *   <li>The startup delay is slept once, before the very first attempt.</li>
 *   <li>{@link #acquire()} makes at most one connection attempt per call; the
 *       scan loop calls it once per cycle.</li>
 *   <li>{@link #drop(Throwable)} closes and forgets the client after any I/O
 *       failure. The next {@link #acquire()} starts over with a fresh client.</li>
 * </ul>
 *
 * <p>Used only from the scan thread.</p>
 */
public final class PlantConnection implements AutoCloseable
{
    private final ModbusClientFactory factory;
    private final String remote;
    private final Duration startupDelay;
    private final Sleeper sleeper;
    private final PlcObservabilitySink sink;

    private ModbusClient client;
    private boolean startupDelayElapsed;

    public PlantConnection(ModbusClientFactory factory,
                           String remote,
                           Duration startupDelay,
                           Sleeper sleeper,
                           PlcObservabilitySink sink)
    {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.startupDelay = Objects.requireNonNull(startupDelay, "startupDelay");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Returns a connected client, connecting first if needed.
     *
     * @return the client, or empty if the connection attempt failed
     * @throws InterruptedException if interrupted during the startup delay
     */
    public Optional<ModbusClient> acquire() throws InterruptedException
    {
        if (client != null && client.isConnected()) {
            return Optional.of(client);
        }
        if (client != null) {
            drop(null);
        }

        if (!startupDelayElapsed) {
            if (!startupDelay.isZero()) {
                sleeper.sleep(startupDelay);
            }
            startupDelayElapsed = true;
        }

        ModbusClient candidate = factory.create();
        try {
            candidate.connect();
        }
        catch (ModbusTransportException e) {
            candidate.close();
            emit(PlantLinkEvent.Kind.CONNECT_FAILED, e);
            return Optional.empty();
        }

        client = candidate;
        emit(PlantLinkEvent.Kind.CONNECTED, null);
        return Optional.of(client);
    }

    /**
     * Returns the client only if it is already connected. Never connects.
     */
    public Optional<ModbusClient> current()
    {
        if (client != null && client.isConnected()) {
            return Optional.of(client);
        }
        return Optional.empty();
    }

    public boolean isConnected()
    {
        return current().isPresent();
    }

    /**
     * Closes and forgets the current client.
     */
    public void drop(Throwable cause)
    {
        ModbusClient c = client;
        client = null;
        if (c != null) {
            c.close();
            emit(PlantLinkEvent.Kind.DROPPED, cause);
        }
    }

    /**
     * Closes the current client, then the factory.
     */
    @Override
    public void close()
    {
        ModbusClient c = client;
        client = null;
        if (c != null) {
            c.close();
        }
        factory.close();
    }

    private void emit(PlantLinkEvent.Kind kind, Throwable cause)
    {
        sink.onPlantLinkEvent(new PlantLinkEvent(SystemWallClock.INSTANCE.now(), kind, remote, cause));
    }
}
