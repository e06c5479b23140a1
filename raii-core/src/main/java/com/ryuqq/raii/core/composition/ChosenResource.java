package com.ryuqq.raii.core.composition;

import com.ryuqq.raii.core.resource.ResourceFactory;

import java.util.List;

/**
 * 경쟁 합성(chooseAny)의 값.
 *
 * <p>residuals는 경주에서 진 팩토리들로, 경주가 시작한 계산을 그대로 감싸고 있으며
 * 처음부터 다시 획득하지 않습니다. residuals의 소유권은 호출자에게 넘어가며,
 * 호출자는 각각을 획득 후 반납하거나 의식적으로 버려야 합니다.
 * 그렇지 않으면 자원 누수이며, 그 책임은 호출자에게 있습니다.</p>
 *
 * @param winner 가장 먼저 획득을 마친 팩토리의 값
 * @param residuals 나머지 팩토리 (원래 순서, 승자 제외)
 * @param <F> 호스트 effect witness 타입
 * @param <A> 값 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ChosenResource<F, A>(A winner, List<ResourceFactory<F, A>> residuals) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException residuals가 null인 경우
     */
    public ChosenResource {
        if (residuals == null) {
            throw new IllegalArgumentException("residuals cannot be null");
        }
        residuals = List.copyOf(residuals);
    }
}
