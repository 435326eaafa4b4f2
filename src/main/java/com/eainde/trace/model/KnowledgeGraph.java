package com.eainde.trace.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * In-memory node/edge model linking the claims and variables of two documents.
 *
 * <p>Nodes are unique by id and keep insertion order; edges may repeat. The graph is
 * append-only: every mutator returns a new instance and nothing is ever removed.</p>
 */
@EqualsAndHashCode
@ToString
public final class KnowledgeGraph implements Serializable {

    private static final KnowledgeGraph EMPTY = new KnowledgeGraph(new LinkedHashMap<>(), new ArrayList<>());

    private final LinkedHashMap<String, GraphNode> nodes;
    private final ArrayList<GraphEdge> edges;

    private KnowledgeGraph(LinkedHashMap<String, GraphNode> nodes, ArrayList<GraphEdge> edges) {
        this.nodes = nodes;
        this.edges = edges;
    }

    public static KnowledgeGraph empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder(EMPTY);
    }

    /** Starts a builder seeded with this graph's content. */
    public Builder toBuilder() {
        return new Builder(this);
    }

    @JsonProperty("nodes")
    public List<GraphNode> nodes() {
        return List.copyOf(nodes.values());
    }

    @JsonProperty("edges")
    public List<GraphEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public Optional<GraphNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public List<GraphEdge> edges(EdgeRelation relation) {
        return edges.stream()
                .filter(edge -> edge.relation() == relation)
                .collect(Collectors.toList());
    }

    /** Ids of every claim node, in insertion order. */
    public Set<String> claimIds() {
        return nodes.values().stream()
                .filter(GraphNode::isClaim)
                .map(GraphNode::id)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Ids of the claim nodes contributed by one document. */
    public Set<String> claimIds(DocumentOrigin origin) {
        return nodes.values().stream()
                .filter(GraphNode::isClaim)
                .filter(node -> node.source() == origin)
                .map(GraphNode::id)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public static final class Builder {

        private final LinkedHashMap<String, GraphNode> nodes;
        private final ArrayList<GraphEdge> edges;

        private Builder(KnowledgeGraph seed) {
            this.nodes = new LinkedHashMap<>(seed.nodes);
            this.edges = new ArrayList<>(seed.edges);
        }

        /**
         * Adds a node unless one with the same id already exists.
         *
         * @return {@code true} when the node was added
         */
        public boolean addNodeIfAbsent(GraphNode node) {
            return nodes.putIfAbsent(node.id(), node) == null;
        }

        public Builder addNode(GraphNode node) {
            if (!addNodeIfAbsent(node)) {
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            }
            return this;
        }

        public Builder addEdge(GraphEdge edge) {
            edges.add(edge);
            return this;
        }

        public Builder addEdges(Collection<GraphEdge> newEdges) {
            edges.addAll(newEdges);
            return this;
        }

        public KnowledgeGraph build() {
            return new KnowledgeGraph(new LinkedHashMap<>(nodes), new ArrayList<>(edges));
        }
    }
}
