package tech.noetzold.results_gateway;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.*;
import tech.noetzold.results_gateway.config.GatewayProperties;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final IdentityInterceptor identityInterceptor;
    private final GatewayProperties properties;
    private final String apiDocsPath;

    public WebConfig(IdentityInterceptor identityInterceptor, GatewayProperties properties,
                     @Value("${springdoc.api-docs.path:/v3/api-docs}") String apiDocsPath) {
        this.identityInterceptor = identityInterceptor;
        this.properties = properties;
        this.apiDocsPath = apiDocsPath;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        String prefix = properties.getApiPrefix();
        registry.addInterceptor(identityInterceptor)
                .addPathPatterns(prefix + "/**")
                .excludePathPatterns(
                        prefix + "/groups",
                        prefix + "/content",
                        apiDocsPath,
                        apiDocsPath + "/**",
                        "/health",
                        "/actuator/**"
                );
    }
}
