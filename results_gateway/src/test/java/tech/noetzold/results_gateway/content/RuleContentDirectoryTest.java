package tech.noetzold.results_gateway.content;

import org.junit.jupiter.api.Test;
import tech.noetzold.results_gateway.config.GatewayProperties;
import tech.noetzold.results_gateway.exception.ContentServiceTimeoutException;
import tech.noetzold.results_gateway.model.RuleContent;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static tech.noetzold.results_gateway.TestData.content;

class RuleContentDirectoryTest {

    private static RuleContentDirectory directory(long waitTimeoutMs) {
        GatewayProperties properties = new GatewayProperties();
        properties.getContent().setWaitTimeoutMs(waitTimeoutMs);
        return new RuleContentDirectory(properties);
    }

    @Test
    void findsContentIgnoringReportSuffix() {
        RuleContentDirectory directory = directory(100);
        directory.publish(List.of(content("node_check", "NODE_DOWN")));

        assertTrue(directory.contentFor("node_check.report", "NODE_DOWN").isPresent());
        assertTrue(directory.contentFor("node_check", "NODE_DOWN").isPresent());
        assertTrue(directory.contentFor("node_check", "OTHER").isEmpty());
    }

    @Test
    void lookupBeforeFirstLoadTimesOut() {
        RuleContentDirectory directory = directory(50);

        assertThrows(ContentServiceTimeoutException.class, () -> directory.contentFor("a", "A"));
    }

    @Test
    void lookupWaitsForFirstLoad() throws Exception {
        RuleContentDirectory directory = directory(5_000);

        CompletableFuture<Optional<RuleContent>> lookup =
                CompletableFuture.supplyAsync(() -> directory.contentFor("a", "A"));
        directory.publish(List.of(content("a", "A")));

        assertTrue(lookup.get(5, TimeUnit.SECONDS).isPresent());
    }

    @Test
    void publishReplacesWholeDirectory() {
        RuleContentDirectory directory = directory(100);
        directory.publish(List.of(content("a", "A")));
        directory.publish(List.of(content("b", "B")));

        assertTrue(directory.contentFor("a", "A").isEmpty());
        assertTrue(directory.contentFor("b", "B").isPresent());
    }
}
