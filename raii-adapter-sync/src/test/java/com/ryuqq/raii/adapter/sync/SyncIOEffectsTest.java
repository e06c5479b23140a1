package com.ryuqq.raii.adapter.sync;

import com.ryuqq.raii.core.outcome.Attempt;
import com.ryuqq.raii.core.spi.Effect;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SyncIOEffects 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SyncIOEffectsTest {

    private final SyncIOEffects effects = SyncIOEffects.INSTANCE;

    @Test
    void flatMap_실패시_continuation_실행하지_않음() {
        // given
        AtomicBoolean invoked = new AtomicBoolean();
        IllegalStateException boom = new IllegalStateException("boom");

        // when
        Attempt<Throwable, String> outcome = SyncIO.narrow(effects.flatMap(effects.<Integer>raiseError(boom), value -> {
            invoked.set(true);
            return effects.point(() -> "never");
        })).unsafeRunAttempt();

        // then
        assertThat(outcome.isFailed()).isTrue();
        assertThat(invoked).isFalse();
    }

    @Test
    void flatMap_continuation_예외는_에러_채널로_캡처() {
        // given
        IllegalStateException boom = new IllegalStateException("boom");

        // when
        Effect<SyncIO.Witness, String> chained = effects.<Integer, String>flatMap(effects.point(() -> 1), value -> {
            throw boom;
        });

        // then
        Attempt<Throwable, String> outcome = SyncIO.narrow(chained).unsafeRunAttempt();
        assertThat(outcome.<Throwable>fold(error -> error, value -> null)).isSameAs(boom);
    }

    @Test
    void flatMap_천_단계_체인_정상_실행() {
        // given
        Effect<SyncIO.Witness, Integer> chain = effects.point(() -> 0);
        for (int i = 0; i < 1_000; i++) {
            chain = effects.flatMap(chain, value -> effects.point(() -> value + 1));
        }

        // when
        int result = SyncIO.narrow(chain).unsafeRun();

        // then
        assertThat(result).isEqualTo(1_000);
    }

    @Test
    void map2_왼쪽부터_순차_실행() {
        // given
        List<String> order = new ArrayList<>();
        Effect<SyncIO.Witness, String> left = effects.point(() -> {
            order.add("left");
            return "L";
        });
        Effect<SyncIO.Witness, String> right = effects.point(() -> {
            order.add("right");
            return "R";
        });

        // when
        String combined = SyncIO.narrow(effects.map2(left, right, (l, r) -> l + r)).unsafeRun();

        // then
        assertThat(combined).isEqualTo("LR");
        assertThat(order).containsExactly("left", "right");
    }

    @Test
    void handleError_실패를_복구() {
        // when
        String recovered = SyncIO.narrow(effects.handleError(
            effects.<String>raiseError(new IllegalStateException("boom")),
            error -> effects.point(() -> "recovered:" + error.getMessage()))).unsafeRun();

        // then
        assertThat(recovered).isEqualTo("recovered:boom");
    }

    @Test
    void attempt_실패를_값으로_변환() {
        // given
        IllegalStateException boom = new IllegalStateException("boom");

        // when
        Attempt<Throwable, String> attempt = SyncIO.narrow(effects.attempt(effects.<String>raiseError(boom))).unsafeRun();

        // then
        assertThat(attempt.isFailed()).isTrue();
    }

    @Test
    void unit_단일_값() {
        assertThat(SyncIO.narrow(effects.unit()).unsafeRun()).hasToString("()");
    }
}
