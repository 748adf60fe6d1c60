package tech.noetzold.results_gateway.content;

import tech.noetzold.results_gateway.exception.ContentServiceTimeoutException;
import tech.noetzold.results_gateway.model.RuleContent;

import java.util.Optional;

/**
 * Empty means no content exists. Unavailability is thrown.
 */
@FunctionalInterface
public interface ContentLookup {

    Optional<RuleContent> contentFor(String ruleId, String errorKey) throws ContentServiceTimeoutException;
}
