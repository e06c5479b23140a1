package com.ryuqq.raii.testkit.fixture;

/**
 * 이미 열려 있는 id의 {@link FakeResource}를 다시 열려고 할 때 발생.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CannotOpenResourceTwiceException extends IllegalStateException {

    private final String resourceId;

    public CannotOpenResourceTwiceException(String resourceId) {
        super("Cannot open resource twice: " + resourceId);
        this.resourceId = resourceId;
    }

    public String getResourceId() {
        return resourceId;
    }
}
