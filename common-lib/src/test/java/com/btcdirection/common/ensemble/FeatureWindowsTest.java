package com.btcdirection.common.ensemble;

import com.btcdirection.common.model.FeatureRow;
import com.btcdirection.common.model.InputShape;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureWindowsTest {

    @Test
    @DisplayName("Short history is left-padded with the earliest row")
    void leftPad() {
        List<FeatureRow> h = EnsembleFixtures.history(3);
        assertThat(FeatureWindows.select(h, InputShape.window(5)))
            .containsExactly(h.get(0), h.get(0), h.get(0), h.get(1), h.get(2));
    }

    @Test
    @DisplayName("Long history keeps only the latest rows")
    void tail() {
        List<FeatureRow> h = EnsembleFixtures.history(8);
        assertThat(FeatureWindows.select(h, InputShape.window(5))).containsExactlyElementsOf(h.subList(3, 8));
        assertThat(FeatureWindows.select(h, InputShape.singleRow())).containsExactly(h.get(7));
    }

    @Test
    @DisplayName("Empty history is rejected")
    void empty() {
        assertThatThrownBy(() -> FeatureWindows.select(List.of(), InputShape.singleRow()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Stacking follows the requested column order and applies scaling per row")
    void stack() {
        List<FeatureRow> h = EnsembleFixtures.history(2);
        double[][] m = FeatureWindows.stack(h, List.of("roc_1d", "bb_width"),
            new StandardScalingTransform(new double[]{1, 0}, new double[]{2, 0}));
        assertThat(m[0]).containsExactly(0.0, 1.0);
        assertThat(m[1]).containsExactly(0.5, 2.0);
    }
}
