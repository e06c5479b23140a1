package com.ryuqq.raii.adapter.async;

import com.ryuqq.raii.core.resource.ResourceFactory;
import com.ryuqq.raii.core.spi.Effect;
import com.ryuqq.raii.testkit.fixture.EventLog;
import com.ryuqq.raii.testkit.fixture.RecordingResource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TaskRuntime 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TaskRuntimeTest {

    private TaskRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = new TaskRuntime(new TaskRuntimeConfig(2, "runtime-test-", 1000));
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    @Test
    void constructor_NullConfig_ThrowsException() {
        assertThatThrownBy(() -> new TaskRuntime(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
    }

    @Test
    void point_설정된_이름의_데몬_스레드에서_실행() {
        // given
        AtomicReference<Thread> runner = new AtomicReference<>();

        // when
        runtime.await(runtime.effects().point(() -> {
            runner.set(Thread.currentThread());
            return "done";
        }), 5000);

        // then
        assertThat(runner.get().getName()).startsWith("runtime-test-");
        assertThat(runner.get().isDaemon()).isTrue();
    }

    @Test
    void factories_자원_획득_사용_해제() {
        // given
        EventLog events = new EventLog();
        ResourceFactory<Task.Witness, String> name = runtime.factories().map(
            runtime.factories().managed(() -> RecordingResource.open(events, "r0")), RecordingResource::name);

        // when
        String result = runtime.await(runtime.factories().run(name), 5000);

        // then
        assertThat(result).isEqualTo("r0");
        assertThat(events.events()).containsExactly("acquire r0", "release r0");
    }

    @Test
    void await_unchecked_실패는_원래_예외로_던짐() {
        // given
        IllegalStateException boom = new IllegalStateException("boom");
        Effect<Task.Witness, String> failing = runtime.effects().point(() -> {
            throw boom;
        });

        // when & then
        assertThatThrownBy(() -> runtime.await(failing, 5000)).isSameAs(boom);
    }

    @Test
    void await_checked_실패는_CompletionException으로_감쌈() {
        // given
        IOException diskFailure = new IOException("disk");

        // when & then
        assertThatThrownBy(() -> runtime.await(Task.<String>failed(diskFailure), 5000))
            .isInstanceOf(CompletionException.class)
            .hasCause(diskFailure);
    }

    @Test
    void await_시간_초과시_IllegalStateException() {
        // given
        Task<String> never = Task.fromFuture(CompletableFuture::new);

        // when & then
        assertThatThrownBy(() -> runtime.await(never, 50))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("did not complete within 50ms");
    }

    @Test
    void await_잘못된_timeout은_거부() {
        assertThatThrownBy(() -> runtime.await(Task.fromFuture(() -> CompletableFuture.completedFuture("v")), 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("timeoutMs must be positive");
    }

    @Test
    void racing_승자_반환() {
        // when
        String winner = runtime.await(runtime.racing().run(runtime.racing().map(
            runtime.racing().chooseAny(runtime.racing().pure("only"), List.of()),
            chosen -> chosen.winner())), 5000);

        // then
        assertThat(winner).isEqualTo("only");
    }
}
