package tech.noetzold.results_gateway.content;

import org.springframework.stereotype.Component;
import tech.noetzold.results_gateway.exception.ServiceUnavailableException;
import tech.noetzold.results_gateway.exception.UpstreamDecodeException;
import tech.noetzold.results_gateway.exception.UpstreamResponseException;
import tech.noetzold.results_gateway.model.RuleGroup;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Latest rule groups, or the error of the latest refresh. Reads never block.
 */
@Component
public class RuleGroupsMailbox {

    private final AtomicReference<Slot> slot = new AtomicReference<>();

    public void publish(List<RuleGroup> groups) {
        slot.set(new Slot(List.copyOf(groups), null));
    }

    public void publishError(RuntimeException error) {
        slot.set(new Slot(null, error));
    }

    public List<RuleGroup> latest() {
        Slot current = slot.get();
        if (current == null) {
            return List.of();
        }
        if (current.error() != null) {
            throw rethrowable(current.error());
        }
        return current.groups();
    }

    // every reader gets its own instance, the stored one stays untouched
    private static RuntimeException rethrowable(RuntimeException stored) {
        if (stored instanceof ServiceUnavailableException unavailable) {
            return unavailable.getBackend().unavailable(stored);
        }
        if (stored instanceof UpstreamResponseException response) {
            return new UpstreamResponseException(response.getStatusCode(), response.getBody(), response.getContentType());
        }
        return new UpstreamDecodeException("Rule groups are unavailable", stored);
    }

    private record Slot(List<RuleGroup> groups, RuntimeException error) {}
}
