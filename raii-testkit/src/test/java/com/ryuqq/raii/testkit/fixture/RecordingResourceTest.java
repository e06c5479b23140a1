package com.ryuqq.raii.testkit.fixture;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RecordingResource / EventLog / IdGenerators 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RecordingResourceTest {

    @Test
    void open_RecordsAcquireAndRelease() {
        // Given
        EventLog events = new EventLog();

        // When
        RecordingResource resource = RecordingResource.open(events, "r0");
        resource.close();

        // Then
        assertEquals(List.of("acquire r0", "release r0"), events.events());
    }

    @Test
    void failingOnClose_RecordsReleaseThenThrows() {
        // Given
        EventLog events = new EventLog();
        RecordingResource resource = RecordingResource.failingOnClose(events, "r0");

        // When & Then
        ReleaseFailedException exception = assertThrows(ReleaseFailedException.class, resource::close);
        assertEquals("r0", exception.getResourceName());
        assertEquals(List.of("acquire r0", "release r0"), events.events());
    }

    @Test
    void eventLog_EventsIsSnapshot() {
        // Given
        EventLog events = new EventLog();
        events.record("first");

        // When
        List<String> snapshot = events.events();
        events.record("second");

        // Then
        assertEquals(List.of("first"), snapshot);
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add("third"));
    }

    @Test
    void constantIdGenerator_BlankId_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> IdGenerators.constant(" ")
        );
        assertTrue(exception.getMessage().contains("id cannot be null or blank"));
    }

    @Test
    void sequentialIdGenerator_IndependentCounters() {
        // When
        String first = IdGenerators.sequential().get();
        String second = IdGenerators.sequential().get();

        // Then
        assertEquals("0", first);
        assertEquals("0", second);
    }
}
