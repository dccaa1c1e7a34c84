package com.delta.gapreview.workflow.service;

import com.delta.gapreview.collab.StructuredTaskClient;
import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.error.SchemaViolationException;
import com.delta.gapreview.error.UpstreamUnavailableException;
import com.delta.gapreview.workflow.model.AlignmentScore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StructuredTaskInvokerTest {

    @Mock
    private StructuredTaskClient client;

    @Test
    void schemaViolationGetsOneCorrectiveRetry() {
        when(client.invoke(eq("score_alignment"), anyMap(), eq(AlignmentScore.class)))
            .thenThrow(new SchemaViolationException("score missing"))
            .thenReturn(new AlignmentScore(0.7, "ok"));

        AlignmentScore score = invoker().invoke("score_alignment", Map.of("sourceText", "cv"), AlignmentScore.class);

        assertThat(score.score()).isEqualTo(0.7);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> inputs = ArgumentCaptor.forClass(Map.class);
        verify(client, times(2)).invoke(eq("score_alignment"), inputs.capture(), eq(AlignmentScore.class));
        assertThat(inputs.getAllValues().get(0)).doesNotContainKey(StructuredTaskInvoker.CORRECTION_HINT);
        assertThat(inputs.getAllValues().get(1))
            .containsEntry("sourceText", "cv")
            .containsKey(StructuredTaskInvoker.CORRECTION_HINT);
    }

    @Test
    void secondSchemaViolationPropagates() {
        when(client.invoke(eq("score_alignment"), anyMap(), eq(AlignmentScore.class)))
            .thenThrow(new SchemaViolationException("score missing"));

        assertThatThrownBy(() -> invoker().invoke("score_alignment", Map.of(), AlignmentScore.class))
            .isInstanceOf(SchemaViolationException.class);
        verify(client, times(2)).invoke(eq("score_alignment"), anyMap(), eq(AlignmentScore.class));
    }

    @Test
    void upstreamOutageIsRetriedWithoutHint() {
        when(client.invoke(eq("score_alignment"), anyMap(), eq(AlignmentScore.class)))
            .thenThrow(new UpstreamUnavailableException("503", true))
            .thenReturn(new AlignmentScore(0.4, null));

        assertThat(invoker().invoke("score_alignment", Map.of(), AlignmentScore.class).score()).isEqualTo(0.4);
    }

    private StructuredTaskInvoker invoker() {
        ReviewProperties properties = new ReviewProperties();
        properties.getRetry().setBaseDelayMs(0);
        return new StructuredTaskInvoker(client, new RetryPolicy(properties));
    }
}
