package com.forecastplatform.common.context;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.forecastplatform.common.model.ChildNode;
import com.forecastplatform.common.model.PathNode;
import com.forecastplatform.common.model.SiblingNode;
import com.forecastplatform.common.model.Source;

import java.util.List;

/**
 * Flattened "input context" for one node, as consumed by training-data exporters.
 *
 * <p>Pure value data: the node's upward, lateral and downward relationships are carried as
 * copies ({@code pathFromRoot}, {@code siblings}, {@code existingChildren}), never as
 * identifiers pointing back into the tree.
 *
 * <p>{@code existingChildren} is {@code null} when the caller asked to leave the
 * downward view out; it is then omitted from JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScenarioContext(
    @JsonProperty("event")                 String            event,
    @JsonProperty("depth")                 int               depth,
    @JsonProperty("timeframe")             String            timeframe,
    @JsonProperty("pathFromRoot")          List<PathNode>    pathFromRoot,
    @JsonProperty("cumulativeProbability") double            cumulativeProbability,
    @JsonProperty("siblings")              List<SiblingNode> siblings,
    @JsonProperty("existingChildren")      List<ChildNode>   existingChildren,
    @JsonProperty("researchSummary")       String            researchSummary,
    @JsonProperty("sources")               List<Source>      sources,
    @JsonProperty("queriesExecuted")       List<String>      queriesExecuted,
    @JsonProperty("sentiment")             int               sentiment,
    @JsonProperty("justification")         String            justification
) {}
