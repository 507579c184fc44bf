package com.whereq.modelhub.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Aggregators Unit Tests")
class AggregatorsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    @DisplayName("Mean of a flat array is a scalar")
    void shouldAverageScalars() throws Exception {
        JsonNode result = Aggregators.apply(AggregateOperation.MEAN, json("[1, 2, 3, 4]"), null);

        assertThat(result.asDouble()).isEqualTo(2.5);
    }

    @Test
    @DisplayName("Mean of vectors is element-wise")
    void shouldAverageElementWise() throws Exception {
        JsonNode result = Aggregators.apply(AggregateOperation.MEAN, json("[[0, 2], [2, 4]]"), null);

        assertThat(result.get(0).asDouble()).isEqualTo(1.0);
        assertThat(result.get(1).asDouble()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Ensemble weights each model's vector")
    void shouldWeightEnsemble() throws Exception {
        JsonNode result = Aggregators.apply(AggregateOperation.ENSEMBLE, json("[[1, 0], [0, 1]]"),
            json("{\"weights\": [3, 1]}"));

        assertThat(result.get(0).asDouble()).isCloseTo(0.75, within(1e-9));
        assertThat(result.get(1).asDouble()).isCloseTo(0.25, within(1e-9));
    }

    @Test
    @DisplayName("Ensemble rejects a weight count that does not match")
    void shouldRejectMismatchedWeights() throws Exception {
        JsonNode data = json("[[1, 0], [0, 1]]");
        JsonNode params = json("{\"weights\": [1]}");

        assertThatThrownBy(() -> Aggregators.apply(AggregateOperation.ENSEMBLE, data, params))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Vote returns the majority label with counts")
    void shouldVoteForMajorityLabel() throws Exception {
        JsonNode result = Aggregators.apply(AggregateOperation.VOTE, json("[\"cat\", \"dog\", \"cat\"]"), null);

        assertThat(result.get("label").asText()).isEqualTo("cat");
        assertThat(result.get("votes").asInt()).isEqualTo(2);
        assertThat(result.get("total").asInt()).isEqualTo(3);
    }

    @Test
    @DisplayName("Probability vectors vote for their argmax")
    void shouldVoteWithArgmax() throws Exception {
        JsonNode result = Aggregators.apply(AggregateOperation.VOTE,
            json("[[0.1, 0.9], [0.8, 0.2], [0.3, 0.7]]"), null);

        assertThat(result.get("label").asInt()).isEqualTo(1);
        assertThat(result.get("votes").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("Ties go to the label seen first")
    void shouldBreakTiesByFirstSeen() throws Exception {
        JsonNode result = Aggregators.apply(AggregateOperation.VOTE, json("[\"b\", \"a\", \"a\", \"b\"]"), null);

        assertThat(result.get("label").asText()).isEqualTo("b");
    }
}
