package tech.noetzold.results_gateway.content;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import tech.noetzold.results_gateway.client.ContentServiceClient;
import tech.noetzold.results_gateway.model.RuleContent;
import tech.noetzold.results_gateway.model.RuleGroup;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ContentRefreshService {

    private final ContentServiceClient contentServiceClient;
    private final RuleContentDirectory contentDirectory;
    private final RuleGroupsMailbox groupsMailbox;

    @Scheduled(fixedDelayString = "${gateway.content.refresh-interval-ms:60000}")
    public void refresh() {
        refreshContent();
        refreshGroups();
    }

    void refreshContent() {
        try {
            List<RuleContent> rules = contentServiceClient.fetchRuleContent();
            contentDirectory.publish(rules);
        } catch (RuntimeException e) {
            log.error("Unable to refresh rule content, keeping the previous directory", e);
        }
    }

    void refreshGroups() {
        try {
            List<RuleGroup> groups = contentServiceClient.fetchRuleGroups();
            groupsMailbox.publish(groups);
            log.debug("Published {} rule groups", groups.size());
        } catch (RuntimeException e) {
            log.error("Error occurred during groups retrieval from content service", e);
            groupsMailbox.publishError(e);
        }
    }
}
