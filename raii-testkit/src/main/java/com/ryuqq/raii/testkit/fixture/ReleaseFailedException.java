package com.ryuqq.raii.testkit.fixture;

/**
 * {@link RecordingResource#failingOnClose}로 만든 자원의 close()가 던지는 예외.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ReleaseFailedException extends RuntimeException {

    private final String resourceName;

    public ReleaseFailedException(String resourceName) {
        super("Release failed: " + resourceName);
        this.resourceName = resourceName;
    }

    public String getResourceName() {
        return resourceName;
    }
}
