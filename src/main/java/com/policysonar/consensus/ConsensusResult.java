package com.policysonar.consensus;

import com.policysonar.external.AnalysisSource;

import java.util.List;

public final class ConsensusResult {
    public final ConsensusMetrics metrics;
    public final List<String> journals;
    public final List<AnalysisSource> sources;

    public ConsensusResult(ConsensusMetrics metrics, List<String> journals, List<AnalysisSource> sources) {
        this.metrics = metrics;
        this.journals = List.copyOf(journals);
        this.sources = List.copyOf(sources);
    }
}
