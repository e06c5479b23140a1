package com.ryuqq.raii.testkit.contract;

import com.ryuqq.raii.core.composition.ChosenResource;
import com.ryuqq.raii.core.composition.ResourceFactories;
import com.ryuqq.raii.core.composition.ResourceFactoryNondeterminism;
import com.ryuqq.raii.core.resource.ResourceFactory;
import com.ryuqq.raii.core.spi.Nondeterminism;
import com.ryuqq.raii.testkit.fixture.FakeResource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: racing composition (chooseAny).
 *
 * <p>Only hosts with a racing primitive run this contract.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>n contenders → one winner, n-1 residuals</li>
 *   <li>Releasing the race releases only the winner</li>
 *   <li>Residuals are owned by the caller and release their own resource exactly once</li>
 * </ul>
 *
 * @param <F> host effect witness type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class RacingCompositionContract<F> extends AbstractResourceContractTest<F> {

    /**
     * Racing capability of the host under test.
     *
     * @return Nondeterminism instance sharing the harness's execution context
     */
    protected abstract Nondeterminism<F> nondeterminism();

    protected ResourceFactoryNondeterminism<F> racing() {
        return ResourceFactories.nondeterminism(nondeterminism());
    }

    @Test
    void testChooseAny_OneWinner_ResidualsForTheRest() {
        // Given
        List<ResourceFactory<F, FakeResource>> contenders = List.of(exclusive("a"), exclusive("b"), exclusive("c"));

        // When
        ChosenResource<F, FakeResource> chosen = awaitValue(racing().run(racing().chooseAny(contenders)));

        // Then
        String winner = chosen.winner().id();
        assertTrue(Set.of("a", "b", "c").contains(winner));
        assertEquals(2, chosen.residuals().size());
        assertReleasedOnce(winner);
    }

    @Test
    void testChooseAny_ReleasingWinner_DoesNotReleaseResiduals() {
        // Given
        List<ResourceFactory<F, FakeResource>> contenders = List.of(exclusive("a"), exclusive("b"), exclusive("c"));

        // When
        ChosenResource<F, FakeResource> chosen = awaitValue(racing().run(racing().chooseAny(contenders)));

        // Then
        String winner = chosen.winner().id();
        for (String id : List.of("a", "b", "c")) {
            if (!id.equals(winner)) {
                assertNotReleased(id);
            }
        }
    }

    @Test
    void testChooseAny_ResidualsReleasedByCaller_NoLeak() {
        // Given
        List<ResourceFactory<F, FakeResource>> contenders = List.of(exclusive("a"), exclusive("b"), exclusive("c"));
        ChosenResource<F, FakeResource> chosen = awaitValue(racing().run(racing().chooseAny(contenders)));

        // When
        List<String> residualIds = new ArrayList<>();
        for (ResourceFactory<F, FakeResource> residual : chosen.residuals()) {
            residualIds.add(awaitValue(racing().run(racing().map(residual, FakeResource::id))));
        }

        // Then
        assertFalse(residualIds.contains(chosen.winner().id()));
        assertEquals(Set.of("a", "b", "c"), Set.of(chosen.winner().id(), residualIds.get(0), residualIds.get(1)));
        for (String id : List.of("a", "b", "c")) {
            assertReleasedOnce(id);
        }
        assertNoLeak();
    }

    @Test
    void testChooseAny_SingleContender_WinsWithNoResiduals() {
        // Given
        ResourceFactory<F, ChosenResource<F, FakeResource>> race = racing().chooseAny(exclusive("solo"), List.of());

        // When
        ChosenResource<F, FakeResource> chosen = awaitValue(racing().run(race));

        // Then
        assertEquals("solo", chosen.winner().id());
        assertTrue(chosen.residuals().isEmpty());
        assertNoLeak();
    }

    @Test
    void testChooseAny_EmptyList_Rejected() {
        // When & Then
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> racing().chooseAny(List.<ResourceFactory<F, FakeResource>>of()));
        assertTrue(exception.getMessage().contains("cannot be null or empty"));
    }
}
