package com.groviate.aicodereviewer.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

/**
 * Таймауты RestClient, через который Spring AI ходит к моделям.
 * Ревью большого файла может генерироваться минутами.
 */
@Configuration
@Slf4j
public class AiHttpTimeoutConfig {

    @Bean
    public RestClientCustomizer aiRestClientCustomizer(CodeReviewProperties props) {
        return restClientBuilder -> {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(props.getProvider().getConnectTimeout());
            requestFactory.setReadTimeout(props.getProvider().getReadTimeout());
            restClientBuilder.requestFactory(requestFactory);

            log.debug("RestClient для AI: connectTimeout={}, readTimeout={}",
                    props.getProvider().getConnectTimeout(), props.getProvider().getReadTimeout());
        };
    }
}
