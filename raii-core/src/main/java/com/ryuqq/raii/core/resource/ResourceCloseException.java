package com.ryuqq.raii.core.resource;

/**
 * 관리 자원의 {@link AutoCloseable#close()}가 checked 예외를 던졌을 때 이를 감싸는 예외.
 *
 * <p>unchecked 예외는 감싸지 않고 그대로 전파되므로, 호스트 에러 채널에는
 * 자원이 던진 원래 예외가 그대로 보입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ResourceCloseException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param resource 닫기에 실패한 자원
     * @param cause close()가 던진 checked 예외
     */
    public ResourceCloseException(Object resource, Exception cause) {
        super("Failed to close resource: " + resource, cause);
    }
}
