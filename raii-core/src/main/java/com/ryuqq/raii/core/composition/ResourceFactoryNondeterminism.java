package com.ryuqq.raii.core.composition;

import com.ryuqq.raii.core.resource.Handle;
import com.ryuqq.raii.core.resource.ResourceFactory;
import com.ryuqq.raii.core.spi.Effect;
import com.ryuqq.raii.core.spi.Nondeterminism;
import com.ryuqq.raii.core.spi.RaceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 호스트 {@link Nondeterminism} 위에서 동작하는 경쟁 합성 (chooseAny).
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>모든 팩토리의 획득 계산을 만들어 호스트의 경주 기본 연산에 넘김</li>
 *   <li>가장 먼저 획득을 마친 Handle이 승자</li>
 *   <li>나머지 계산은 {@link ChosenResource#residuals()}로 다시 포장 (재시작하지 않음)</li>
 *   <li>합성 Handle의 release는 <strong>승자만</strong> 반납</li>
 * </ol>
 *
 * <p><strong>주의:</strong> 진 쪽 계산은 취소되지 않습니다. 취소는 전적으로 호스트 effect의 몫이며,
 * residual을 반납하지 않은 채 버리는 것은 호출자가 책임지는 누수입니다.</p>
 *
 * @param <F> 호스트 effect witness 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ResourceFactoryNondeterminism<F> extends ResourceFactoryMonad<F> {

    private static final Logger log = LoggerFactory.getLogger(ResourceFactoryNondeterminism.class);

    private final Nondeterminism<F> nondeterminism;

    /**
     * 생성자.
     *
     * @param nondeterminism 호스트 effect
     * @throws IllegalArgumentException nondeterminism이 null인 경우
     */
    public ResourceFactoryNondeterminism(Nondeterminism<F> nondeterminism) {
        super(nondeterminism);
        this.nondeterminism = nondeterminism;
    }

    /**
     * 팩토리들의 획득을 경주시킴.
     *
     * @param head 첫 번째 팩토리 (비어 있지 않음을 보장)
     * @param tail 나머지 팩토리 (비어 있을 수 있음)
     * @param <A> 값 타입
     * @return 승자 값과 residual 팩토리를 담은 팩토리
     * @throws IllegalArgumentException head 또는 tail이 null인 경우
     */
    public <A> ResourceFactory<F, ChosenResource<F, A>> chooseAny(ResourceFactory<F, A> head,
                                                                 List<? extends ResourceFactory<F, A>> tail) {
        if (head == null) {
            throw new IllegalArgumentException("head cannot be null");
        }
        if (tail == null) {
            throw new IllegalArgumentException("tail cannot be null");
        }
        return () -> {
            List<Effect<F, Handle<F, A>>> pending = tail.stream()
                .map(ResourceFactory::acquire)
                .collect(Collectors.toList());
            return nondeterminism.map(nondeterminism.chooseAny(head.acquire(), pending), this::toChosen);
        };
    }

    /**
     * 팩토리 목록의 획득을 경주시킴.
     *
     * @param factories 경주시킬 팩토리 (1개 이상)
     * @param <A> 값 타입
     * @return 승자 값과 residual 팩토리를 담은 팩토리
     * @throws IllegalArgumentException factories가 null이거나 비어 있는 경우
     */
    public <A> ResourceFactory<F, ChosenResource<F, A>> chooseAny(List<? extends ResourceFactory<F, A>> factories) {
        if (factories == null || factories.isEmpty()) {
            throw new IllegalArgumentException("factories cannot be null or empty");
        }
        return chooseAny(factories.get(0), factories.subList(1, factories.size()));
    }

    /**
     * 호스트 effect 조회.
     *
     * @return 생성 시 주입된 Nondeterminism
     */
    public Nondeterminism<F> nondeterminism() {
        return nondeterminism;
    }

    private <A> Handle<F, ChosenResource<F, A>> toChosen(RaceResult<F, Handle<F, A>> race) {
        Handle<F, A> winner = race.winner();
        List<ResourceFactory<F, A>> residuals = race.residuals().stream()
            .map(ResourceFactoryNondeterminism::<F, A>residual)
            .collect(Collectors.toList());
        log.debug("Race settled: winner={}, residuals={}", winner.value(), residuals.size());
        return Handle.<F, ChosenResource<F, A>>of(new ChosenResource<>(winner.value(), residuals), winner::release);
    }

    private static <F, A> ResourceFactory<F, A> residual(Effect<F, Handle<F, A>> pending) {
        return () -> pending;
    }
}
