package tech.noetzold.results_gateway.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.results_gateway.content.RuleGroupsMailbox;
import tech.noetzold.results_gateway.model.ApiResponse;
import tech.noetzold.results_gateway.proxy.Backend;
import tech.noetzold.results_gateway.proxy.ProxyDispatcher;
import tech.noetzold.results_gateway.proxy.ProxyHandler;
import tech.noetzold.results_gateway.proxy.ProxyOptions;

import java.io.IOException;
import java.util.Map;

@Tag(name = "Content")
@RestController
@RequestMapping("${gateway.api-prefix:/api/v1}")
public class ContentController {

    private final RuleGroupsMailbox groupsMailbox;
    private final ProxyHandler contentProxy;

    public ContentController(RuleGroupsMailbox groupsMailbox, ProxyDispatcher proxyDispatcher) {
        this.groupsMailbox = groupsMailbox;
        this.contentProxy = proxyDispatcher.proxyTo(Backend.CONTENT, ProxyOptions.none());
    }

    @GetMapping("/groups")
    public Map<String, Object> groups() {
        return ApiResponse.ok("groups", groupsMailbox.latest());
    }

    @GetMapping("/content")
    public void content(HttpServletRequest request, HttpServletResponse response) throws IOException {
        contentProxy.handle(request, response);
    }
}
