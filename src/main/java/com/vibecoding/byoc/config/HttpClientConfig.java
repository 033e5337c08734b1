package com.vibecoding.byoc.config;

import com.vibecoding.byoc.client.Sleeper;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.time.Clock;

/**
 * 컨트롤 플레인 HTTP 클라이언트 구성
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate controlPlaneRestTemplate(RestTemplateBuilder builder, ControlPlaneConfig config) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory() {
            @Override
            protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
                super.prepareConnection(connection, httpMethod);
                // 리다이렉트는 따라가지 않고 실패로 분류
                connection.setInstanceFollowRedirects(false);
            }
        };
        requestFactory.setConnectTimeout((int) config.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) config.getReadTimeout().toMillis());

        return builder
            .requestFactory(() -> requestFactory)
            .errorHandler(passThroughErrorHandler())
            .build();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 상태 코드 분류는 ControlPlaneClient가 담당
     */
    public static ResponseErrorHandler passThroughErrorHandler() {
        return new ResponseErrorHandler() {
            @Override
            public boolean hasError(ClientHttpResponse response) {
                return false;
            }

            @Override
            public void handleError(ClientHttpResponse response) {
            }
        };
    }
}
