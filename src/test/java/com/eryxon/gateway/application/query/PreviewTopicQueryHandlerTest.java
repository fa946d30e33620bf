package com.eryxon.gateway.application.query;

import com.eryxon.gateway.domain.event.EventContext;
import com.eryxon.gateway.domain.exception.ValidationException;
import com.eryxon.gateway.domain.model.HierarchyDefaults;
import com.eryxon.gateway.tags.UnitTest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@UnitTest
class PreviewTopicQueryHandlerTest {

    private final PreviewTopicQueryHandler handler = new PreviewTopicQueryHandler();

    @Test
    void shouldResolveDefaultPatternWhenNoneGiven() {
        // Given
        PreviewTopicQuery query = new PreviewTopicQuery(null, "operation.started", "t-1",
                new EventContext(null, null, null, "Cell 3", null, null, null, null, null),
                new HierarchyDefaults("Acme", null, null));

        // When
        TopicPreviewResponse response = handler.handle(query);

        // Then
        assertThat(response.getTopic()).isEqualTo("acme/main/production/cell_3/operation/started");
        assertThat(response.getUnknownPlaceholders()).isEmpty();
    }

    @Test
    void shouldReportUnknownPlaceholders() {
        PreviewTopicQuery query = new PreviewTopicQuery("{site}/{machine}/{event}", "job.created", "t-1",
                null, null);

        TopicPreviewResponse response = handler.handle(query);

        assertThat(response.getTopic()).isEqualTo("main/job/created");
        assertThat(response.getUnknownPlaceholders()).containsExactly("machine");
    }

    @Test
    void shouldRequireEventType() {
        assertThatThrownBy(() -> handler.handle(new PreviewTopicQuery("{event}", " ", "t-1", null, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("event_type is required");
    }
}
