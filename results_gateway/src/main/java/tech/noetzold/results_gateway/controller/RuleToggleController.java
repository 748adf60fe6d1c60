package tech.noetzold.results_gateway.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.results_gateway.proxy.Backend;
import tech.noetzold.results_gateway.proxy.ProxyDispatcher;
import tech.noetzold.results_gateway.proxy.ProxyHandler;
import tech.noetzold.results_gateway.proxy.ProxyOptions;
import tech.noetzold.results_gateway.proxy.UserIdRequestModifier;

import java.io.IOException;

/**
 * Enable, disable and feedback calls for a rule on a cluster, forwarded to the
 * aggregator under the caller's user ID.
 */
@Tag(name = "Reports")
@RestController
@RequestMapping("${gateway.api-prefix:/api/v1}/clusters/{cluster}/rules/{rule_id}/error_key/{error_key}")
public class RuleToggleController {

    static final String ENABLE_ENDPOINT = "clusters/{cluster}/rules/{rule_id}/error_key/{error_key}/users/{user_id}/enable";
    static final String DISABLE_ENDPOINT = "clusters/{cluster}/rules/{rule_id}/error_key/{error_key}/users/{user_id}/disable";
    static final String DISABLE_FEEDBACK_ENDPOINT = "clusters/{cluster}/rules/{rule_id}/error_key/{error_key}/users/{user_id}/disable_feedback";

    private final ProxyHandler enableProxy;
    private final ProxyHandler disableProxy;
    private final ProxyHandler disableFeedbackProxy;

    public RuleToggleController(ProxyDispatcher proxyDispatcher) {
        this.enableProxy = proxyDispatcher.proxyTo(Backend.AGGREGATOR,
                ProxyOptions.requestModifiers(new UserIdRequestModifier(ENABLE_ENDPOINT)));
        this.disableProxy = proxyDispatcher.proxyTo(Backend.AGGREGATOR,
                ProxyOptions.requestModifiers(new UserIdRequestModifier(DISABLE_ENDPOINT)));
        this.disableFeedbackProxy = proxyDispatcher.proxyTo(Backend.AGGREGATOR,
                ProxyOptions.requestModifiers(new UserIdRequestModifier(DISABLE_FEEDBACK_ENDPOINT)));
    }

    @PutMapping("/enable")
    public void enable(@PathVariable("cluster") String cluster, HttpServletRequest request, HttpServletResponse response)
            throws IOException {
        RequestParams.clusterName(cluster);
        enableProxy.handle(request, response);
    }

    @PutMapping("/disable")
    public void disable(@PathVariable("cluster") String cluster, HttpServletRequest request, HttpServletResponse response)
            throws IOException {
        RequestParams.clusterName(cluster);
        disableProxy.handle(request, response);
    }

    @PostMapping("/disable_feedback")
    public void disableFeedback(@PathVariable("cluster") String cluster, HttpServletRequest request,
                                HttpServletResponse response) throws IOException {
        RequestParams.clusterName(cluster);
        disableFeedbackProxy.handle(request, response);
    }
}
