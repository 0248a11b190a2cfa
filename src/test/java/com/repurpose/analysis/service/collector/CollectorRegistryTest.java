package com.repurpose.analysis.service.collector;

import com.repurpose.analysis.EvidenceFixtures;
import com.repurpose.analysis.model.CollectorId;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CollectorRegistryTest {

    @Test
    public void findsCollectorsById() {
        CollectorRegistry registry = new CollectorRegistry(
                List.of(StubCollector.returning(EvidenceFixtures.metforminLiterature())), id -> Duration.ofSeconds(3));

        assertTrue(registry.find(CollectorId.LITERATURE).isPresent());
        assertTrue(registry.find(CollectorId.TRIALS).isEmpty());
        assertEquals(Duration.ofSeconds(3), registry.budgetFor(CollectorId.TRIALS));
    }

    @Test
    public void duplicateRegistrationFails() {
        assertThrows(IllegalStateException.class, () -> new CollectorRegistry(List.of(
                StubCollector.returning(EvidenceFixtures.metforminLiterature()),
                StubCollector.returning(EvidenceFixtures.metforminLiterature())), id -> Duration.ofSeconds(1)));
    }
}
