package com.demo.trends.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

/** Client for the interest provider. */
@Configuration
public class HttpConfig {

    @Value("${trends.provider.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${trends.provider.read-timeout-ms:8000}")
    private int readTimeoutMs;

    @Bean
    public RestTemplate restTemplate(ObjectMapper objectMapper) {
        RestTemplate rest = new RestTemplate(new HttpComponentsClientHttpRequestFactory(httpClient()));
        rest.getMessageConverters().removeIf(c -> c instanceof MappingJackson2HttpMessageConverter);
        rest.getMessageConverters().add(new MappingJackson2HttpMessageConverter(objectMapper));
        return rest;
    }

    // a timed-out read surfaces as SocketTimeoutException, i.e. a fetch failure
    CloseableHttpClient httpClient() {
        ConnectionConfig connection = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                .setSocketTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                .build();
        RequestConfig request = RequestConfig.custom()
                .setResponseTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                .build();
        return HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(connection)
                        .build())
                .setDefaultRequestConfig(request)
                .build();
    }
}
