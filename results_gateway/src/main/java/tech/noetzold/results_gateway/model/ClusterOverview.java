package tech.noetzold.results_gateway.model;

import java.util.List;

public record ClusterOverview(
        List<Integer> totalRisksHit,
        List<String> tagsHit
) {}
