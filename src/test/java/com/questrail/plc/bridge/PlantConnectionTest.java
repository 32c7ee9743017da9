package com.questrail.plc.bridge;

import com.questrail.plc.observability.PlantLinkEvent;
import com.questrail.plc.observability.RecordingObservabilitySink;
import com.questrail.plc.protocol.modbus.client.FakeModbusClient;
import com.questrail.plc.time.ManualMonotonicClock;
import com.questrail.plc.time.RecordingSleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlantConnectionTest {

    private final FakeModbusClient fake = new FakeModbusClient();
    private final RecordingSleeper sleeper = new RecordingSleeper(new ManualMonotonicClock());
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private PlantConnection connection(Duration startupDelay) {
        return new PlantConnection(fake.factory(), "physical-model:503", startupDelay, sleeper, sink);
    }

    @Test
    void startupDelayIsSleptOnceBeforeFirstAttempt() throws InterruptedException {
        PlantConnection plant = connection(Duration.ofSeconds(2));
        fake.refuseConnect(true);

        assertTrue(plant.acquire().isEmpty());
        assertTrue(plant.acquire().isEmpty());

        assertEquals(List.of(Duration.ofSeconds(2)), sleeper.sleeps());
        assertEquals(2, fake.connectAttempts());
    }

    @Test
    void acquireConnectsOnceAndReusesTheClient() throws InterruptedException {
        PlantConnection plant = connection(Duration.ZERO);

        assertTrue(plant.acquire().isPresent());
        assertTrue(plant.acquire().isPresent());

        assertEquals(1, fake.created());
        assertEquals(1, fake.connectAttempts());
        assertTrue(plant.isConnected());
        assertEquals(List.of(PlantLinkEvent.Kind.CONNECTED), sink.linkEventKinds());
        assertTrue(sleeper.sleeps().isEmpty());
    }

    @Test
    void failedAttemptIsReportedAndRetriedNextCall() throws InterruptedException {
        PlantConnection plant = connection(Duration.ZERO);
        fake.refuseConnect(true);

        assertTrue(plant.acquire().isEmpty());
        fake.refuseConnect(false);
        assertTrue(plant.acquire().isPresent());

        assertEquals(List.of(PlantLinkEvent.Kind.CONNECT_FAILED, PlantLinkEvent.Kind.CONNECTED),
                sink.linkEventKinds());
        PlantLinkEvent failed = sink.eventsOfType(PlantLinkEvent.class).get(0);
        assertEquals("physical-model:503", failed.remote());
        assertNotNull(failed.cause());
    }

    @Test
    void currentNeverConnects() {
        PlantConnection plant = connection(Duration.ZERO);

        assertTrue(plant.current().isEmpty());
        assertEquals(0, fake.connectAttempts());
    }

    @Test
    void dropClosesClientAndNextAcquireStartsOver() throws InterruptedException {
        PlantConnection plant = connection(Duration.ZERO);
        plant.acquire();

        plant.drop(new RuntimeException("boom"));

        assertFalse(fake.isConnected());
        assertFalse(plant.isConnected());
        assertTrue(plant.acquire().isPresent());
        assertEquals(2, fake.created());
        assertEquals(List.of(PlantLinkEvent.Kind.CONNECTED, PlantLinkEvent.Kind.DROPPED, PlantLinkEvent.Kind.CONNECTED),
                sink.linkEventKinds());
    }

    @Test
    void dropWithoutClientIsSilent() {
        connection(Duration.ZERO).drop(null);

        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void remoteDisconnectIsNoticedOnAcquire() throws InterruptedException {
        PlantConnection plant = connection(Duration.ZERO);
        plant.acquire();
        fake.disconnect();

        assertTrue(plant.acquire().isPresent());
        assertEquals(2, fake.connectAttempts());
    }

    @Test
    void closeReleasesClientAndFactory() throws InterruptedException {
        PlantConnection plant = connection(Duration.ZERO);
        assertTrue(plant.acquire().isPresent());

        plant.close();

        assertFalse(plant.isConnected());
        assertFalse(fake.isConnected());
        assertTrue(fake.factoryClosed());
    }
}
