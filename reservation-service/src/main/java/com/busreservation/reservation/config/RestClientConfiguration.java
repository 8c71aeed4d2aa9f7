package com.busreservation.reservation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * RestTemplate bound to the catalog service; callers pass paths only.
 */
@Configuration
public class RestClientConfiguration {

    @Bean
    public RestTemplate catalogRestTemplate(
            RestTemplateBuilder builder,
            ObjectMapper objectMapper,
            @Value("${catalog-service.url}") String catalogServiceUrl,
            @Value("${http.client.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${http.client.read-timeout-ms:10000}") long readTimeoutMs) {

        MappingJackson2HttpMessageConverter jsonConverter = new MappingJackson2HttpMessageConverter(objectMapper);

        return builder
                .rootUri(catalogServiceUrl)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .additionalMessageConverters(jsonConverter)
                .build();
    }
}
