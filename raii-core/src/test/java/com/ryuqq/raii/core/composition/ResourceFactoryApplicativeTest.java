package com.ryuqq.raii.core.composition;

import com.ryuqq.raii.core.resource.ResourceCloseException;
import com.ryuqq.raii.core.resource.ResourceFactory;
import com.ryuqq.raii.core.support.LazyEffect;
import com.ryuqq.raii.core.support.LazyEffects;
import com.ryuqq.raii.core.support.TrackedResources;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * ResourceFactoryApplicative 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ResourceFactoryApplicativeTest {

    @Mock
    private AutoCloseable closeable;

    @Mock
    private Runnable leftRelease;

    @Mock
    private Runnable rightRelease;

    private LazyEffects effects;
    private TrackedResources resources;
    private ResourceFactoryApplicative<LazyEffect.Witness> factories;

    @BeforeEach
    void setUp() {
        effects = new LazyEffects();
        resources = new TrackedResources(effects);
        factories = ResourceFactories.applicative(effects);
    }

    @Test
    void constructor_NullApplicative_ThrowsException() {
        assertThatThrownBy(() -> new ResourceFactoryApplicative<LazyEffect.Witness>(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("applicative cannot be null");
    }

    @Test
    void point_acquire_할때마다_supplier_재평가() {
        // given
        AtomicInteger evaluations = new AtomicInteger();
        ResourceFactory<LazyEffect.Witness, Integer> counter = factories.point(evaluations::incrementAndGet);

        // when
        Integer first = LazyEffect.narrow(counter.run(monad())).value();
        Integer second = LazyEffect.narrow(counter.run(monad())).value();

        // then
        assertThat(first).isEqualTo(1);
        assertThat(second).isEqualTo(2);
    }

    @Test
    void pure_값을_그대로_반환() {
        // when
        String result = LazyEffect.narrow(factories.pure("value").run(monad())).value();

        // then
        assertThat(result).isEqualTo("value");
    }

    @Test
    void liftEffect_effect_실패가_획득_실패로_전파() {
        // given
        IllegalStateException boom = new IllegalStateException("boom");

        // when
        Throwable error = LazyEffect.narrow(
            factories.liftEffect(effects.<String>raiseError(boom)).run(monad())).error();

        // then
        assertThat(error).isSameAs(boom);
    }

    @Test
    void managed_생성은_acquire_시점까지_지연되고_해제시_close_호출() throws Exception {
        // given
        AtomicInteger constructed = new AtomicInteger();
        ResourceFactory<LazyEffect.Witness, AutoCloseable> managed = factories.managed(() -> {
            constructed.incrementAndGet();
            return closeable;
        });

        // then
        assertThat(constructed).hasValue(0);

        // when
        LazyEffect.narrow(managed.run(monad())).value();

        // then
        assertThat(constructed).hasValue(1);
        verify(closeable, times(1)).close();
    }

    @Test
    void managed_close가_checked_예외를_던지면_ResourceCloseException으로_감쌈() throws Exception {
        // given
        IOException diskFailure = new IOException("disk");
        doThrow(diskFailure).when(closeable).close();

        // when
        Throwable error = LazyEffect.narrow(factories.managed(() -> closeable).run(monad())).error();

        // then
        assertThat(error)
            .isInstanceOf(ResourceCloseException.class)
            .hasCause(diskFailure);
    }

    @Test
    void managed_close가_unchecked_예외를_던지면_그대로_전파() throws Exception {
        // given
        IllegalStateException closeFailure = new IllegalStateException("close failed");
        doThrow(closeFailure).when(closeable).close();

        // when
        Throwable error = LazyEffect.narrow(factories.managed(() -> closeable).run(monad())).error();

        // then
        assertThat(error).isSameAs(closeFailure);
    }

    @Test
    void managed_NullConstructor_ThrowsException() {
        assertThatThrownBy(() -> factories.managed(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("constructor cannot be null");
    }

    @Test
    void map2_두_자원_모두_해제() {
        // given
        ResourceFactory<LazyEffect.Witness, String> pair = factories.map2(
            resources.resource("left", leftRelease), resources.resource("right", rightRelease),
            (left, right) -> left + "+" + right);

        // when
        String result = LazyEffect.narrow(pair.run(monad())).value();

        // then
        assertThat(result).isEqualTo("left+right");
        verify(leftRelease).run();
        verify(rightRelease).run();
    }

    @Test
    void ap_함수_팩토리와_값_팩토리_모두_해제() {
        // given
        Function<? super String, ? extends Integer> length = String::length;
        ResourceFactory<LazyEffect.Witness, Function<? super String, ? extends Integer>> fn =
            resources.resource(length, leftRelease);

        // when
        Integer result = LazyEffect.narrow(
            factories.ap(resources.resource("value", rightRelease), fn).run(monad())).value();

        // then
        assertThat(result).isEqualTo(5);
        verify(leftRelease).run();
        verify(rightRelease).run();
    }

    @Test
    void map_해제는_원본_자원의_해제() {
        // when
        Integer result = LazyEffect.narrow(
            factories.map(resources.resource("value", leftRelease), String::length).run(monad())).value();

        // then
        assertThat(result).isEqualTo(5);
        verify(leftRelease).run();
    }

    private LazyEffects monad() {
        return effects;
    }
}
