package com.skillswap.billing.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClients for the outbound collaborators. Call timeouts are applied per request.
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient paymentGatewayWebClient(WebClient.Builder builder, BillingProperties properties) {
        WebClient.Builder gateway = builder.clone()
                .baseUrl(properties.gateway().baseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(properties.gateway().secretKey())) {
            gateway.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.gateway().secretKey());
        }
        return gateway.build();
    }

    @Bean
    public WebClient notificationWebClient(WebClient.Builder builder, BillingProperties properties) {
        WebClient.Builder notification = builder.clone()
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(properties.notification().url())) {
            notification.baseUrl(properties.notification().url());
        }
        return notification.build();
    }
}
