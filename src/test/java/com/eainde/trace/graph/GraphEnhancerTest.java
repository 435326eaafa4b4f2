package com.eainde.trace.graph;

import com.eainde.trace.Fixtures;
import com.eainde.trace.error.MissingFieldException;
import com.eainde.trace.model.DocumentOrigin;
import com.eainde.trace.model.EdgeRelation;
import com.eainde.trace.model.GraphEdge;
import com.eainde.trace.model.GraphNode;
import com.eainde.trace.model.KnowledgeGraph;
import com.eainde.trace.model.SynergyAnalysis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphEnhancerTest {

    private final GraphEnhancer enhancer = new GraphEnhancer();
    private KnowledgeGraph base;

    @BeforeEach
    void setUp() {
        base = new DocumentGraphBuilder().build(Fixtures.paperA(), Fixtures.paperB());
    }

    @Nested
    @DisplayName("Overlap variables")
    class OverlapVariables {

        @Test
        @DisplayName("should add a 'both' node var_temperature")
        void addsOverlapNode() {
            KnowledgeGraph enhanced = enhancer.enhance(base, Fixtures.analysis());

            assertThat(enhanced.nodeCount()).isEqualTo(base.nodeCount() + 1);
            assertThat(enhanced.node("var_temperature")).get()
                    .extracting(GraphNode::source, GraphNode::text)
                    .containsExactly(DocumentOrigin.BOTH, "temperature");
        }

        @Test
        @DisplayName("should normalise names and skip ids that already exist")
        void skipsExisting() {
            SynergyAnalysis analysis = new SynergyAnalysis(
                    List.of("State Of Health", "state of health"), List.of(), List.of());

            KnowledgeGraph enhanced = enhancer.enhance(base, analysis);

            assertThat(enhanced.nodes()).extracting(GraphNode::id)
                    .containsOnlyOnce("var_state_of_health");
            assertThat(enhancer.enhance(enhanced, analysis).nodeCount()).isEqualTo(enhanced.nodeCount());
        }
    }

    @Nested
    @DisplayName("Cross-product edges")
    class CrossProduct {

        @Test
        @DisplayName("should add N x M edges per synergy and conflict, tagged with their ids")
        void nTimesM() {
            // GIVEN
            SynergyAnalysis analysis = new SynergyAnalysis(
                    List.of(),
                    List.of(Fixtures.synergy("syn_1", "d", List.of("A_claim_1", "A_claim_2"), List.of("B_claim_1", "B_x", "B_y"))),
                    List.of(Fixtures.synergy("conf_1", "d", List.of("A_claim_2"), List.of("B_claim_1"))));

            // WHEN
            KnowledgeGraph enhanced = enhancer.enhance(base, analysis);

            // THEN
            assertThat(enhanced.edges(EdgeRelation.POTENTIAL_SYNERGY))
                    .hasSize(6)
                    .allMatch(edge -> "syn_1".equals(edge.synergyId()));
            assertThat(enhanced.edges(EdgeRelation.POTENTIAL_CONFLICT))
                    .containsExactly(GraphEdge.conflict("A_claim_2", "B_claim_1", "conf_1"));
        }

        @Test
        @DisplayName("should never remove existing nodes or edges")
        void monotone() {
            KnowledgeGraph enhanced = enhancer.enhance(base, Fixtures.analysis());

            assertThat(enhanced.nodes()).containsAll(base.nodes());
            assertThat(enhanced.edges()).containsAll(base.edges());
            assertThat(enhanced.edgeCount()).isEqualTo(base.edgeCount() + 1);
        }
    }

    @Test
    @DisplayName("should reject an analysis with missing fields")
    void missingFields() {
        SynergyAnalysis incomplete = new SynergyAnalysis(List.of(), null, null);

        assertThatThrownBy(() -> enhancer.enhance(base, incomplete))
                .isInstanceOf(MissingFieldException.class)
                .hasMessageContaining("synergy_analysis.potential_synergies")
                .hasMessageContaining("synergy_analysis.potential_conflicts");
    }
}
