package com.ryuqq.raii.adapter.sync;

import com.ryuqq.raii.core.composition.ResourceFactoryMonadError;
import com.ryuqq.raii.core.resource.ResourceFactory;
import com.ryuqq.raii.testkit.fixture.EventLog;
import com.ryuqq.raii.testkit.fixture.RecordingResource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SyncIOResources 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SyncIOResourcesTest {

    private EventLog events;
    private ResourceFactoryMonadError<SyncIO.Witness, Throwable> factories;

    @BeforeEach
    void setUp() {
        events = new EventLog();
        factories = SyncIOResources.factories();
    }

    @Test
    void run_값_반환_후_해제() {
        // given
        ResourceFactory<SyncIO.Witness, String> name =
            factories.map(factories.managed(() -> RecordingResource.open(events, "r0")), RecordingResource::name);

        // when
        String result = SyncIOResources.run(name);

        // then
        assertThat(result).isEqualTo("r0");
        assertThat(events.events()).containsExactly("acquire r0", "release r0");
    }

    @Test
    void foreach_사용_중_자원이_열려있고_이후_해제() {
        // given
        ResourceFactory<SyncIO.Witness, RecordingResource> r0 =
            factories.managed(() -> RecordingResource.open(events, "r0"));

        // when
        SyncIOResources.foreach(r0, resource -> events.record("use " + resource.name()));

        // then
        assertThat(events.events()).containsExactly("acquire r0", "use r0", "release r0");
    }

    @Test
    void foreach_consumer_예외시에도_해제_후_예외_전파() {
        // given
        IllegalStateException boom = new IllegalStateException("boom");
        ResourceFactory<SyncIO.Witness, RecordingResource> r0 =
            factories.managed(() -> RecordingResource.open(events, "r0"));

        // when & then
        assertThatThrownBy(() -> SyncIOResources.foreach(r0, resource -> {
            throw boom;
        })).isSameAs(boom);
        assertThat(events.events()).containsExactly("acquire r0", "release r0");
    }

    @Test
    void foreach_NullConsumer_ThrowsException() {
        assertThatThrownBy(() -> SyncIOResources.foreach(factories.pure("value"), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("consumer cannot be null");
    }
}
