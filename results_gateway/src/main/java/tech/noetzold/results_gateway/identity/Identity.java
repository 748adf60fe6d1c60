package tech.noetzold.results_gateway.identity;

/**
 * Caller identity taken from the authentication token. {@code internalOrgId} scopes
 * every organization lookup.
 */
public record Identity(
        String accountNumber,
        long orgId,
        long internalOrgId
) {}
