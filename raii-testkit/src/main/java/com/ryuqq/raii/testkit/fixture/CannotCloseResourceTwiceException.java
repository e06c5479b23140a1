package com.ryuqq.raii.testkit.fixture;

/**
 * 열려 있지 않은 {@link FakeResource}를 닫으려고 할 때 발생 (이중 해제).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CannotCloseResourceTwiceException extends IllegalStateException {

    private final String resourceId;

    public CannotCloseResourceTwiceException(String resourceId) {
        super("Cannot close resource twice: " + resourceId);
        this.resourceId = resourceId;
    }

    public String getResourceId() {
        return resourceId;
    }
}
