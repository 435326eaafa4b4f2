package com.eainde.trace.graph;

import com.eainde.trace.Fixtures;
import com.eainde.trace.error.MissingFieldException;
import com.eainde.trace.model.DocumentOrigin;
import com.eainde.trace.model.DocumentRecord;
import com.eainde.trace.model.EdgeRelation;
import com.eainde.trace.model.GraphEdge;
import com.eainde.trace.model.GraphNode;
import com.eainde.trace.model.KnowledgeGraph;
import com.eainde.trace.model.NodeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class DocumentGraphBuilderTest {

    private final DocumentGraphBuilder builder = new DocumentGraphBuilder();

    // =========================================================================
    //  Nodes and edges
    // =========================================================================

    @Nested
    @DisplayName("Base graph")
    class BaseGraph {

        @Test
        @DisplayName("should emit claim then variable nodes for A, then for B")
        void nodeOrder() {
            KnowledgeGraph graph = builder.build(Fixtures.paperA(), Fixtures.paperB());

            assertThat(graph.nodes()).extracting(GraphNode::id)
                    .containsExactly("A_claim_1", "A_claim_2", "A_var_1", "B_claim_1", "B_var_1", "B_var_2");
            assertThat(graph.node("B_var_2")).get()
                    .extracting(GraphNode::type, GraphNode::source, GraphNode::text)
                    .containsExactly(NodeType.VARIABLE, DocumentOrigin.B, "voltage");
        }

        @Test
        @DisplayName("should link every claim to every variable of the same document, A first")
        void usesVariableProduct() {
            KnowledgeGraph graph = builder.build(Fixtures.paperA(), Fixtures.paperB());

            assertThat(graph.edges()).containsExactly(
                    GraphEdge.usesVariable("A_claim_1", "A_var_1"),
                    GraphEdge.usesVariable("A_claim_2", "A_var_1"),
                    GraphEdge.usesVariable("B_claim_1", "B_var_1"),
                    GraphEdge.usesVariable("B_claim_1", "B_var_2"));
            assertThat(graph.edges(EdgeRelation.USES_VARIABLE)).hasSize(4);
        }

        @Test
        @DisplayName("should be deterministic")
        void deterministic() {
            assertThat(builder.build(Fixtures.paperA(), Fixtures.paperB()))
                    .isEqualTo(builder.build(Fixtures.paperA(), Fixtures.paperB()));
        }

        @Test
        @DisplayName("should accept documents with empty lists")
        void emptyLists() {
            DocumentRecord empty = new DocumentRecord(List.of(), List.of(), List.of(), List.of(), List.of(), List.of());

            KnowledgeGraph graph = builder.build(empty, Fixtures.paperB());

            assertThat(graph.claimIds(DocumentOrigin.A)).isEmpty();
            assertThat(graph.claimIds(DocumentOrigin.B)).containsExactly("B_claim_1");
        }
    }

    // =========================================================================
    //  Validation
    // =========================================================================

    @Nested
    @DisplayName("Input validation")
    class Validation {

        @Test
        @DisplayName("should name every missing field of both documents")
        void namesAllMissingFields() {
            // GIVEN
            DocumentRecord noVariables = new DocumentRecord(
                    List.of("c1"), List.of(), List.of(), List.of(), List.of(), null);
            DocumentRecord noClaimsNoMethods = new DocumentRecord(
                    null, null, List.of(), List.of(), List.of(), List.of());

            // WHEN
            MissingFieldException error = catchThrowableOfType(
                    () -> builder.build(noVariables, noClaimsNoMethods), MissingFieldException.class);

            // THEN
            assertThat(error.getMissingFields())
                    .containsExactly("Paper A.variables", "Paper B.claims", "Paper B.methods");
        }

        @Test
        @DisplayName("should treat a null document as missing every field")
        void nullDocument() {
            MissingFieldException error = catchThrowableOfType(
                    () -> builder.build(Fixtures.paperA(), null), MissingFieldException.class);

            assertThat(error.getMissingFields())
                    .hasSize(DocumentRecord.REQUIRED_FIELDS.size())
                    .allMatch(field -> field.startsWith("Paper B."));
        }
    }
}
