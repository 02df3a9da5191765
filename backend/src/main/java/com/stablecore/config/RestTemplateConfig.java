package com.stablecore.config;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class RestTemplateConfig {

    @Bean
    @Qualifier("venueRestTemplate")
    public RestTemplate venueRestTemplate(AppProps props) {
        AppProps.Venue venue = props.getVenue();
        return buildRestTemplate(venue.getConnectTimeoutSec(), venue.getReadTimeoutSec());
    }

    static RestTemplate buildRestTemplate(int connectTimeoutSec, int readTimeoutSec) {
        RequestConfig rc = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.ofSeconds(connectTimeoutSec))
                .setConnectTimeout(Timeout.ofSeconds(connectTimeoutSec))
                .setResponseTimeout(Timeout.ofSeconds(readTimeoutSec))
                .build();
        CloseableHttpClient httpClient = HttpClients.custom()
                .setDefaultRequestConfig(rc)
                .build();
        HttpComponentsClientHttpRequestFactory f = new HttpComponentsClientHttpRequestFactory(httpClient);
        f.setConnectTimeout(connectTimeoutSec * 1000);
        return new RestTemplate(f);
    }
}
