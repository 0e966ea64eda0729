package com.jz.injector.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
@RequiredArgsConstructor
public class AffinityClientConfig {

    private final PlannerInjectorProperties props;

    /** 与真寻 api 通信的客户端；连接与读取共用同一个超时 */
    @Bean
    public RestClient affinityRestClient() {
        return buildRestClient(props.getApi());
    }

    @Bean
    public Clock affinityClock() {
        return Clock.systemUTC();
    }

    public static RestClient buildRestClient(PlannerInjectorProperties.Api api) {
        Duration timeout = Duration.ofSeconds(Math.max(1, api.getTimeout()));
        HttpClient http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(http);
        factory.setReadTimeout(timeout);
        return RestClient.builder()
                .requestFactory(factory)
                .build();
    }
}
