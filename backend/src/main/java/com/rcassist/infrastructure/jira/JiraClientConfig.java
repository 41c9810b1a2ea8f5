package com.rcassist.infrastructure.jira;

import com.rcassist.infrastructure.config.RcaProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * Jira REST client shared by ticket reading and ticket creation.
 */
@Slf4j
@Configuration
@Profile("jira")
public class JiraClientConfig {

    @Bean
    public RestClient jiraRestClient(RcaProperties properties) {
        RcaProperties.Jira jira = properties.ticketing().jira();
        if (jira.url() == null || jira.url().isBlank()) {
            throw new IllegalStateException("rca.ticketing.jira.url is required with the jira profile");
        }

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(jira.timeout());
        requestFactory.setReadTimeout(jira.timeout());

        log.info("Jira client configured for {}", jira.url());
        return RestClient.builder()
                .baseUrl(jira.url())
                .requestFactory(requestFactory)
                .defaultHeaders(headers -> {
                    headers.setBasicAuth(jira.username(), jira.apiToken());
                    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
                })
                .build();
    }
}
