package tech.noetzold.results_gateway.filter;

public enum FilterOutcome {
    VISIBLE,
    DISABLED,
    NO_CONTENT
}
