package tech.noetzold.results_gateway.model;

import java.util.List;

/**
 * Cluster report as returned to clients: only visible rules, with the meta count
 * computed from the filtering outcome.
 */
public record FilteredReport(
        ReportMeta meta,
        List<EnrichedRule> data
) {}
