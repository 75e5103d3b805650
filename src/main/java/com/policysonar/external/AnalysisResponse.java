package com.policysonar.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.policysonar.errors.ExternalServiceException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed reply of the policy analysis service.
 */
public final class AnalysisResponse {
    public final String focus;
    public final List<AnalysisSource> sources;

    public AnalysisResponse(String focus, List<AnalysisSource> sources) {
        this.focus = focus;
        this.sources = List.copyOf(sources);
    }

    /**
     * A missing {@code sources} field means no sources; a non-array one is malformed.
     */
    public static AnalysisResponse fromJson(String focus, JsonNode json) throws ExternalServiceException {
        if (json == null || !json.isObject()) {
            throw new ExternalServiceException("Analysis response is not a JSON object");
        }
        JsonNode sourcesNode = json.get("sources");
        List<AnalysisSource> sources = new ArrayList<>();
        if (sourcesNode != null && !sourcesNode.isNull()) {
            if (!sourcesNode.isArray()) {
                throw new ExternalServiceException("Analysis response field 'sources' is not an array");
            }
            for (JsonNode node : sourcesNode) {
                if (node.isObject()) {
                    sources.add(AnalysisSource.fromJson(node));
                }
            }
        }
        return new AnalysisResponse(focus, sources);
    }
}
