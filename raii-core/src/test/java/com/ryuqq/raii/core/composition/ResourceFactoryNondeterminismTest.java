package com.ryuqq.raii.core.composition;

import com.ryuqq.raii.core.resource.ResourceFactory;
import com.ryuqq.raii.core.support.LazyEffect;
import com.ryuqq.raii.core.support.LazyEffects;
import com.ryuqq.raii.core.support.TrackedResources;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * ResourceFactoryNondeterminism 유닛 테스트.
 *
 * <p>테스트 effect는 항상 head를 승자로 정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ResourceFactoryNondeterminismTest {

    @Mock
    private Runnable winnerRelease;

    @Mock
    private Runnable loserRelease;

    private TrackedResources resources;
    private ResourceFactoryNondeterminism<LazyEffect.Witness> factories;

    @BeforeEach
    void setUp() {
        LazyEffects effects = new LazyEffects();
        resources = new TrackedResources(effects);
        factories = ResourceFactories.nondeterminism(effects);
    }

    @Test
    void chooseAny_승자만_해제하고_잔여는_호출자에게_넘김() {
        // given
        ResourceFactory<LazyEffect.Witness, ChosenResource<LazyEffect.Witness, String>> race =
            factories.chooseAny(resources.resource("winner", winnerRelease),
                List.of(resources.resource("loser", loserRelease)));

        // when
        ChosenResource<LazyEffect.Witness, String> chosen = LazyEffect.narrow(factories.run(race)).value();

        // then
        assertThat(chosen.winner()).isEqualTo("winner");
        assertThat(chosen.residuals()).hasSize(1);
        verify(winnerRelease, times(1)).run();
        verifyNoInteractions(loserRelease);
    }

    @Test
    void chooseAny_잔여_팩토리는_자신의_자원을_해제() {
        // given
        ChosenResource<LazyEffect.Witness, String> chosen = LazyEffect.narrow(factories.run(
            factories.chooseAny(resources.resource("winner", winnerRelease),
                List.of(resources.resource("loser", loserRelease))))).value();

        // when
        String residual = LazyEffect.narrow(factories.run(chosen.residuals().get(0))).value();

        // then
        assertThat(residual).isEqualTo("loser");
        verify(loserRelease, times(1)).run();
        verify(winnerRelease, times(1)).run();
    }

    @Test
    void chooseAny_List_첫번째가_head() {
        // when
        ChosenResource<LazyEffect.Witness, String> chosen = LazyEffect.narrow(factories.run(
            factories.chooseAny(List.of(
                resources.resource("first", winnerRelease),
                resources.resource("second", loserRelease))))).value();

        // then
        assertThat(chosen.winner()).isEqualTo("first");
        assertThat(chosen.residuals()).hasSize(1);
    }

    @Test
    void chooseAny_빈_리스트는_거부() {
        assertThatThrownBy(() -> factories.chooseAny(List.<ResourceFactory<LazyEffect.Witness, String>>of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("factories cannot be null or empty");
    }

    @Test
    void chooseAny_NullHead_ThrowsException() {
        assertThatThrownBy(() -> factories.chooseAny(null, List.<ResourceFactory<LazyEffect.Witness, String>>of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("head cannot be null");
    }
}
