package com.jreinhal.hragent.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.hragent.model.ContextPassage;
import com.jreinhal.hragent.model.PipelineState;
import com.jreinhal.hragent.retrieval.ContextRetriever;
import com.jreinhal.hragent.retrieval.RetrievalRequest;
import com.jreinhal.hragent.settings.AgentSettingsFixtures;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ContextRetrievalStageTest {

    private ContextRetriever retriever;
    private ContextRetrievalStage stage;

    @BeforeEach
    void setUp() {
        retriever = mock(ContextRetriever.class);
        stage = new ContextRetrievalStage(retriever, AgentSettingsFixtures.cacheOf(AgentSettingsFixtures.defaults()));
    }

    @Test
    @DisplayName("Passages are retrieved for the request province")
    void retrieves() {
        when(retriever.retrieve(any())).thenReturn(List.of(ContextPassage.of("1", "text", "upload", 0.8)));
        PipelineState state = new PipelineState("vacation", "SK", null, null, List.of());

        stage.apply(state).applyTo(state);

        ArgumentCaptor<RetrievalRequest> captor = ArgumentCaptor.forClass(RetrievalRequest.class);
        verify(retriever).retrieve(captor.capture());
        assertThat(captor.getValue().province()).isEqualTo("SK");
        assertThat(captor.getValue().limit()).isEqualTo(5);
        assertThat(state.getContextDocuments()).hasSize(1);
    }

    @Test
    @DisplayName("Retriever failure leaves empty context and records an error")
    void failure() {
        when(retriever.retrieve(any())).thenThrow(new IllegalStateException("store offline"));
        PipelineState state = new PipelineState("vacation", "SK", null, null, List.of());

        stage.apply(state).applyTo(state);

        assertThat(state.getContextDocuments()).isEmpty();
        assertThat(state.getError()).isEqualTo("Context retrieval error: store offline");
        assertThat(state.hasStageFailure()).isFalse();
    }
}
