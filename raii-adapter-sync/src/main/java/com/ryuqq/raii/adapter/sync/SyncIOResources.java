package com.ryuqq.raii.adapter.sync;

import com.ryuqq.raii.core.composition.ResourceFactories;
import com.ryuqq.raii.core.composition.ResourceFactoryMonadError;
import com.ryuqq.raii.core.resource.ResourceFactory;
import com.ryuqq.raii.core.spi.Unit;

import java.util.function.Consumer;

/**
 * {@link SyncIO} 기반 ResourceFactory를 호출 스레드에서 바로 실행하는 도우미.
 *
 * <p>더 이상 합성하지 않는 호출자를 위한 평탄화 연산입니다.
 * 모든 연산은 에러 인식 합성을 사용하므로, 소비자가 실패해도 자원은 반납됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ResourceFactory&lt;SyncIO.Witness, InputStream&gt; input =
 *     SyncIOResources.factories().managed(() -&gt; open(path));
 *
 * SyncIOResources.foreach(input, in -&gt; copy(in, out));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SyncIOResources {

    private static final ResourceFactoryMonadError<SyncIO.Witness, Throwable> FACTORIES =
        ResourceFactories.monadError(SyncIOEffects.INSTANCE);

    private SyncIOResources() {
    }

    /**
     * SyncIO용 에러 인식 합성 인스턴스.
     *
     * @return 공유 인스턴스
     */
    public static ResourceFactoryMonadError<SyncIO.Witness, Throwable> factories() {
        return FACTORIES;
    }

    /**
     * 획득, 반납 후 값 반환 (즉시 실행).
     *
     * @param factory 팩토리
     * @param <A> 값 타입
     * @return 자원 값 (이미 반납된 상태)
     */
    public static <A> A run(ResourceFactory<SyncIO.Witness, A> factory) {
        return SyncIO.narrow(FACTORIES.run(factory)).unsafeRun();
    }

    /**
     * 획득, 소비자 실행, 반납 (즉시 실행).
     *
     * @param factory 팩토리
     * @param consumer 자원을 쓰는 부수 효과
     * @param <A> 값 타입
     * @throws IllegalArgumentException consumer가 null인 경우
     */
    public static <A> void foreach(ResourceFactory<SyncIO.Witness, A> factory, Consumer<? super A> consumer) {
        if (consumer == null) {
            throw new IllegalArgumentException("consumer cannot be null");
        }
        SyncIO.narrow(FACTORIES.using(factory, value -> SyncIO.delay(() -> {
            consumer.accept(value);
            return Unit.INSTANCE;
        }))).unsafeRun();
    }
}
