package com.btcdirection.prediction.component;

import com.btcdirection.common.model.InputShape;
import com.btcdirection.prediction.client.ModelServingClient;
import com.btcdirection.prediction.dto.PredictRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RemoteModelComponentTest {

    @Mock private ModelServingClient client;

    private static ModelManifest manifest() {
        return new ModelManifest("lr", "2025-06-30", List.of("ROC_1d"), "v1",
                                 Map.of("ROC_1d", "roc_1d"), null);
    }

    @Test
    @DisplayName("predict posts the rows with model id and version")
    void predictDelegates() {
        when(client.predict(eq("/models/lr/predict"), any())).thenReturn(Mono.just(0.62));
        RemoteModelComponent component = RemoteModelComponent.available(
            "lr", 0.5, InputShape.singleRow(), manifest(), "/models/lr/predict", client, Duration.ofSeconds(1));

        double p = component.predict(new double[][] {{0.01}});

        ArgumentCaptor<PredictRequest> request = ArgumentCaptor.forClass(PredictRequest.class);
        verify(client).predict(eq("/models/lr/predict"), request.capture());
        assertThat(p).isEqualTo(0.62);
        assertThat(request.getValue().modelId()).isEqualTo("lr");
        assertThat(request.getValue().version()).isEqualTo("2025-06-30");
        assertThat(request.getValue().rows()).hasDimensions(1, 1);
        assertThat(component.aliasTable().version()).isEqualTo("v1");
        assertThat(component.scaling()).isEmpty();
    }

    @Test
    @DisplayName("A sidecar error surfaces from predict")
    void sidecarError() {
        when(client.predict(any(), any())).thenReturn(Mono.error(new IllegalStateException("503 from sidecar")));
        RemoteModelComponent component = RemoteModelComponent.available(
            "lr", 0.5, InputShape.singleRow(), manifest(), "/models/lr/predict", client, Duration.ofSeconds(1));

        assertThatThrownBy(() -> component.predict(new double[][] {{0.01}}))
            .hasMessageContaining("503 from sidecar");
    }

    @Test
    @DisplayName("An unavailable component never calls the sidecar")
    void unavailable() {
        RemoteModelComponent component = RemoteModelComponent.unavailable(
            "gru", 0.3, InputShape.window(5), "manifest unavailable");

        assertThat(component.isAvailable()).isFalse();
        assertThat(component.version()).isNull();
        assertThatThrownBy(() -> component.predict(new double[][] {{0.0}}))
            .isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(client);
    }
}
