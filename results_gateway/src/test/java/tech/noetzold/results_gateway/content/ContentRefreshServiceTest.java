package tech.noetzold.results_gateway.content;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.noetzold.results_gateway.client.ContentServiceClient;
import tech.noetzold.results_gateway.config.GatewayProperties;
import tech.noetzold.results_gateway.exception.ServiceUnavailableException;
import tech.noetzold.results_gateway.model.RuleGroup;
import tech.noetzold.results_gateway.proxy.Backend;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static tech.noetzold.results_gateway.TestData.content;

class ContentRefreshServiceTest {

    private ContentServiceClient client;
    private RuleContentDirectory directory;
    private RuleGroupsMailbox mailbox;
    private ContentRefreshService refreshService;

    @BeforeEach
    void setUp() {
        client = mock(ContentServiceClient.class);
        GatewayProperties properties = new GatewayProperties();
        properties.getContent().setWaitTimeoutMs(10);
        directory = new RuleContentDirectory(properties);
        mailbox = new RuleGroupsMailbox();
        refreshService = new ContentRefreshService(client, directory, mailbox);
    }

    @Test
    void refreshPublishesContentAndGroups() {
        RuleGroup group = new RuleGroup("Security", "", List.of("security"));
        when(client.fetchRuleContent()).thenReturn(List.of(content("a", "A")));
        when(client.fetchRuleGroups()).thenReturn(List.of(group));

        refreshService.refresh();

        assertTrue(directory.contentFor("a", "A").isPresent());
        assertEquals(List.of(group), mailbox.latest());
    }

    @Test
    void failedContentRefreshKeepsPreviousDirectory() {
        when(client.fetchRuleContent())
                .thenReturn(List.of(content("a", "A")))
                .thenThrow(Backend.CONTENT.unavailable(null));
        when(client.fetchRuleGroups()).thenReturn(List.of());

        refreshService.refresh();
        refreshService.refresh();

        assertTrue(directory.contentFor("a", "A").isPresent());
    }

    @Test
    void failedGroupsRefreshIsPublishedToMailbox() {
        when(client.fetchRuleContent()).thenReturn(List.of());
        when(client.fetchRuleGroups()).thenThrow(Backend.CONTENT.unavailable(null));

        refreshService.refresh();

        assertThrows(ServiceUnavailableException.class, mailbox::latest);
    }
}
