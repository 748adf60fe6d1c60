package tech.noetzold.results_gateway;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import tech.noetzold.results_gateway.config.GatewayProperties;

@Configuration
public class RestConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, GatewayProperties properties) {
        return builder
                .setConnectTimeout(properties.getConnectTimeout())
                .setReadTimeout(properties.getReadTimeout())
                .additionalInterceptors((request, body, execution) -> {
                    request.getHeaders().set("X-Forwarded-By", "results_gateway");
                    return execution.execute(request, body);
                })
                .build();
    }
}
