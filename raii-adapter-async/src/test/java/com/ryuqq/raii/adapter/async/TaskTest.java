package com.ryuqq.raii.adapter.async;

import com.ryuqq.raii.core.spi.Effect;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Task 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TaskTest {

    @Test
    void fromFuture_시작_전까지_future를_만들지_않고_시작마다_새로_만듦() {
        // given
        AtomicInteger starts = new AtomicInteger();
        Task<Integer> task = Task.fromFuture(() -> CompletableFuture.completedFuture(starts.incrementAndGet()));

        // then
        assertThat(starts).hasValue(0);

        // when
        Integer first = task.unsafeToFuture().join();
        Integer second = task.unsafeToFuture().join();

        // then
        assertThat(first).isEqualTo(1);
        assertThat(second).isEqualTo(2);
    }

    @Test
    void unsafeToFuture_시작_중_예외는_실패한_future로_변환() {
        // given
        IllegalStateException boom = new IllegalStateException("boom");
        Task<String> task = Task.fromFuture(() -> {
            throw boom;
        });

        // when
        CompletableFuture<String> future = task.unsafeToFuture();

        // then
        assertThat(future).isCompletedExceptionally();
        assertThatThrownBy(future::join).hasCause(boom);
    }

    @Test
    void failed_실패한_future() {
        // given
        IllegalStateException boom = new IllegalStateException("boom");

        // when
        CompletableFuture<String> future = Task.<String>failed(boom).unsafeToFuture();

        // then
        assertThat(future).isCompletedExceptionally();
    }

    @Test
    void replay_같은_future의_결과를_공유하고_원본을_건드리지_않음() {
        // given
        CompletableFuture<String> pending = new CompletableFuture<>();
        Task<String> replay = Task.replay(pending);

        // when
        CompletableFuture<String> first = replay.unsafeToFuture();
        CompletableFuture<String> second = replay.unsafeToFuture();
        first.cancel(false);
        pending.complete("value");

        // then
        assertThat(pending).isCompletedWithValue("value");
        assertThat(second).isCompletedWithValue("value");
    }

    @Test
    void toCompletionStage_결과_전달() {
        // given
        Task<String> task = Task.fromFuture(() -> CompletableFuture.completedFuture("value"));

        // when
        String value = task.toCompletionStage().toCompletableFuture().join();

        // then
        assertThat(value).isEqualTo("value");
    }

    @Test
    void fromFuture_NullStart_ThrowsException() {
        assertThatThrownBy(() -> Task.fromFuture(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("start cannot be null");
    }

    @Test
    void narrow_같은_인스턴스_반환() {
        // given
        Effect<Task.Witness, String> effect = Task.fromFuture(() -> CompletableFuture.completedFuture("value"));

        // when
        Task<String> narrowed = Task.narrow(effect);

        // then
        assertThat(narrowed).isSameAs(effect);
    }

    @Test
    void narrow_다른_effect는_거부() {
        // given
        Effect<Task.Witness, String> foreign = new Effect<>() {
        };

        // when & then
        assertThatThrownBy(() -> Task.narrow(foreign))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Not a Task computation");
    }
}
