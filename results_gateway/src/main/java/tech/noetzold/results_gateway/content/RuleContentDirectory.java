package tech.noetzold.results_gateway.content;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.noetzold.results_gateway.config.GatewayProperties;
import tech.noetzold.results_gateway.exception.ContentServiceTimeoutException;
import tech.noetzold.results_gateway.model.RuleContent;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process wide directory of rule content, replaced as a whole by the refresher.
 * Lookups made before the first load wait for it, up to the configured timeout.
 */
@Slf4j
@Component
public class RuleContentDirectory implements ContentLookup {

    private static final String REPORT_SUFFIX = ".report";

    private final AtomicReference<Map<Key, RuleContent>> contents = new AtomicReference<>();
    private final CountDownLatch firstLoad = new CountDownLatch(1);
    private final long waitTimeoutMs;

    public RuleContentDirectory(GatewayProperties properties) {
        this.waitTimeoutMs = properties.getContent().getWaitTimeoutMs();
    }

    public void publish(Collection<RuleContent> rules) {
        Map<Key, RuleContent> directory = new HashMap<>();
        for (RuleContent rule : rules) {
            if (rule.ruleId() == null || rule.errorKey() == null) {
                log.warn("Skipping rule content without rule ID or error key: {}", rule);
                continue;
            }
            directory.put(Key.of(rule.ruleId(), rule.errorKey()), rule);
        }
        contents.set(Map.copyOf(directory));
        firstLoad.countDown();
        log.info("Rule content directory updated with {} entries", directory.size());
    }

    @Override
    public Optional<RuleContent> contentFor(String ruleId, String errorKey) {
        return Optional.ofNullable(awaitDirectory().get(Key.of(ruleId, errorKey)));
    }

    private Map<Key, RuleContent> awaitDirectory() {
        Map<Key, RuleContent> current = contents.get();
        if (current != null) {
            return current;
        }
        try {
            if (!firstLoad.await(waitTimeoutMs, TimeUnit.MILLISECONDS)) {
                throw new ContentServiceTimeoutException(
                        "Rule content directory not loaded within " + waitTimeoutMs + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContentServiceTimeoutException("Interrupted while waiting for rule content directory");
        }
        return contents.get();
    }

    // aggregator rule IDs end in ".report", content IDs do not
    record Key(String ruleId, String errorKey) {

        static Key of(String ruleId, String errorKey) {
            String id = ruleId != null && ruleId.endsWith(REPORT_SUFFIX)
                    ? ruleId.substring(0, ruleId.length() - REPORT_SUFFIX.length())
                    : ruleId;
            return new Key(id, errorKey);
        }
    }
}
