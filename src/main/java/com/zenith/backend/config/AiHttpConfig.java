package com.zenith.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class AiHttpConfig {

    @Bean
    public RestTemplate aiRestTemplate(ZenithAiProperties aiProperties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(aiProperties.getHttp().getConnectTimeoutMs());
        factory.setReadTimeout(aiProperties.getHttp().getReadTimeoutMs());
        return new RestTemplate(factory);
    }
}
