package com.eainde.trace.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Directed edge between two node ids. Enhancement edges carry the id of the synergy or conflict
 * that produced them; ids are not checked against the node set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphEdge(
        @JsonProperty("source")      String source,
        @JsonProperty("target")      String target,
        @JsonProperty("relation")    EdgeRelation relation,
        @JsonProperty("synergy_id")  String synergyId,
        @JsonProperty("conflict_id") String conflictId
) implements Serializable {

    public static GraphEdge usesVariable(String claimId, String variableId) {
        return new GraphEdge(claimId, variableId, EdgeRelation.USES_VARIABLE, null, null);
    }

    public static GraphEdge synergy(String source, String target, String synergyId) {
        return new GraphEdge(source, target, EdgeRelation.POTENTIAL_SYNERGY, synergyId, null);
    }

    public static GraphEdge conflict(String source, String target, String conflictId) {
        return new GraphEdge(source, target, EdgeRelation.POTENTIAL_CONFLICT, null, conflictId);
    }
}
