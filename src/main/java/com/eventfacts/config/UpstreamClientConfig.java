package com.eventfacts.config;

import com.eventfacts.infrastructure.upstream.RestUpstreamClient;
import com.eventfacts.infrastructure.upstream.UpstreamClient;
import com.eventfacts.infrastructure.upstream.UpstreamRecordMapper;
import org.apache.hc.client5.http.cookie.BasicCookieStore;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Wires the upstream client. The cookie store is private to the client's
 * HttpClient, so the login session belongs to that one client object.
 */
@Configuration
@EnableConfigurationProperties(UpstreamProperties.class)
public class UpstreamClientConfig {

    @Bean(destroyMethod = "close")
    public CloseableHttpClient upstreamHttpClient() {
        return HttpClients.custom()
                .setDefaultCookieStore(new BasicCookieStore())
                .build();
    }

    @Bean
    public RestTemplate upstreamRestTemplate(RestTemplateBuilder builder,
                                             CloseableHttpClient upstreamHttpClient,
                                             UpstreamProperties properties) {
        return builder
                .rootUri(properties.getBaseUrl())
                .requestFactory(() -> new HttpComponentsClientHttpRequestFactory(upstreamHttpClient))
                .setConnectTimeout(properties.getConnectTimeout())
                .setReadTimeout(properties.getReadTimeout())
                .build();
    }

    @Bean
    public UpstreamClient upstreamClient(RestTemplate upstreamRestTemplate,
                                         UpstreamRecordMapper mapper,
                                         UpstreamProperties properties) {
        return new RestUpstreamClient(upstreamRestTemplate, mapper,
                properties.getUsername(), properties.getPassword());
    }
}
