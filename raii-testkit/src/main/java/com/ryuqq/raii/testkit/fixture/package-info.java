/**
 * Fake resources for exercising resource factories.
 *
 * <p>{@link com.ryuqq.raii.testkit.fixture.FakeResource} enforces exclusive opening against a
 * {@link com.ryuqq.raii.testkit.fixture.ResourceTable};
 * {@link com.ryuqq.raii.testkit.fixture.RecordingResource} only records events and can be told to
 * fail on close.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.raii.testkit.fixture;
