package org.calista.r3.reflect;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ImprovementHandlersTest {

    private ReflectionBaselines baselines;

    @BeforeEach
    void setUp() {
        baselines = new ReflectionBaselines();
    }

    @ParameterizedTest
    @EnumSource(ImprovementKind.class)
    void forKind_shouldHaveHandlerForEveryKind(ImprovementKind kind) {
        assertThat(ImprovementHandlers.forKind(kind)).isNotNull();
    }

    @Test
    void increaseDepth_shouldRaiseBaselineUpToMaximum() {
        String r = ImprovementHandlers.apply(ImprovementProposal.increaseDepth(2, 3), baselines);
        assertThat(r).isEqualTo("reasoning depth 2 -> 3");
        assertThat(baselines.reasoningDepth).isEqualTo(3);

        ImprovementHandlers.apply(ImprovementProposal.increaseDepth(3, 50), baselines);
        assertThat(baselines.reasoningDepth).isEqualTo(ImprovementHandlers.MAX_REASONING_DEPTH);

        String unchanged = ImprovementHandlers.apply(ImprovementProposal.increaseDepth(10, 10), baselines);
        assertThat(unchanged).isEqualTo("reasoning depth unchanged at 10");
    }

    @Test
    void improveCertainty_shouldStepCalibrationByAtMostOneStep() {
        ImprovementHandlers.apply(ImprovementProposal.improveCertainty(0.6, 0.7), baselines);
        assertThat(baselines.certaintyCalibration).isCloseTo(0.05, within(1e-12));

        ImprovementHandlers.apply(ImprovementProposal.improveCertainty(0.68, 0.7), baselines);
        assertThat(baselines.certaintyCalibration).isCloseTo(0.07, within(1e-12));
    }

    @Test
    void improveCertainty_shouldFailWhenCalibrationExhaustedOrNoGap() {
        ImprovementProposal p = ImprovementProposal.improveCertainty(0.5, 0.7);
        baselines.certaintyCalibration = ImprovementHandlers.MAX_CALIBRATION;

        assertThatThrownBy(() -> ImprovementHandlers.apply(p, baselines))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("exhausted");
        assertThatThrownBy(() -> ImprovementHandlers.apply(ImprovementProposal.improveCertainty(0.9, 0.7), new ReflectionBaselines()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void optimizePatterns_shouldRecordPatternsAndRejectEmptyList() {
        String r = ImprovementHandlers.apply(ImprovementProposal.optimizePatterns(List.of("action", "quantified")), baselines);

        assertThat(r).isEqualTo("optimized patterns 2 added, total 2");
        assertThat(baselines.optimizedPatterns).containsExactly("action", "quantified");
        assertThatThrownBy(() -> ImprovementHandlers.apply(ImprovementProposal.optimizePatterns(List.of()), baselines))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void proposal_shouldFailOnMissingParameter() {
        ImprovementProposal broken = new ImprovementProposal(ImprovementKind.INCREASE_REASONING_DEPTH, Map.of());

        assertThatThrownBy(() -> ImprovementHandlers.apply(broken, baselines))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'to'");
    }

    @Test
    void proposal_shouldSerializeAsPlainData() {
        JsonNode json = new ObjectMapper().valueToTree(ImprovementProposal.improveCertainty(0.55, 0.7));

        assertThat(json.get("kind").asText()).isEqualTo("IMPROVE_CERTAINTY");
        assertThat(json.get("impact").asDouble()).isEqualTo(0.10);
        assertThat(json.get("parameters").get("target").asDouble()).isEqualTo(0.7);
    }
}
