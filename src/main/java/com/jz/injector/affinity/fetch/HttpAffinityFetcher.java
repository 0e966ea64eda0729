package com.jz.injector.affinity.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.injector.config.PlannerInjectorProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * 调用真寻 api：POST {url}/get_info/{userId}
 * <p>
 * 超时、连接/状态码错误、响应解析错误三类失败分别记录日志和指标，
 * 但都退化为同一个默认值 (0, 一般)，不向上抛。
 */
@Slf4j
@Component
public class HttpAffinityFetcher implements AffinityFetcher {

    private final RestClient restClient;
    private final ObjectMapper mapper;
    private final PlannerInjectorProperties.Api api;
    private final Executor executor;
    private final MeterRegistry registry;

    private final Map<FetchStatus, Counter> outcomeCounters = new EnumMap<>(FetchStatus.class);
    private final Timer latency;

    public HttpAffinityFetcher(@Qualifier("affinityRestClient") RestClient restClient,
                               ObjectMapper mapper,
                               PlannerInjectorProperties props,
                               @Qualifier("affinityFetchExecutor") Executor executor,
                               MeterRegistry registry) {
        this.restClient = restClient;
        this.mapper = mapper;
        this.api = props.getApi();
        this.executor = executor;
        this.registry = registry;

        for (FetchStatus s : FetchStatus.values()) {
            outcomeCounters.put(s, Counter.builder("affinity.fetch.count")
                    .description("Affinity api calls by outcome")
                    .tag("status", s.name().toLowerCase())
                    .register(registry));
        }
        this.latency = Timer.builder("affinity.fetch.latency")
                .description("Latency of affinity api calls, failures included")
                .register(registry);
    }

    @Override
    public CompletableFuture<AffinityFetchResult> fetchAsync(String userId) {
        return CompletableFuture.supplyAsync(() -> fetch(userId), executor);
    }

    @Override
    public AffinityFetchResult fetch(String userId) {
        Timer.Sample sample = Timer.start(registry);
        AffinityFetchResult result = doFetch(userId);
        sample.stop(latency);
        outcomeCounters.get(result.getStatus()).increment();
        return result;
    }

    private AffinityFetchResult doFetch(String userId) {
        String url = stripTrailingSlash(api.getUrl()) + "/get_info/" + userId;
        try {
            String body = restClient.post()
                    .uri(stripTrailingSlash(api.getUrl()) + "/get_info/{userId}", userId)
                    .retrieve()
                    .body(String.class);

            AffinityFetchResult ok = decode(body);
            log.debug("API 请求成功，用户 {} 的好感度为 {}", userId, ok.getImpression());
            return ok;
        } catch (RestClientResponseException e) {
            log.error("API 请求失败: {} {}", e.getStatusCode(), url);
            return fallback(FetchStatus.TRANSPORT_ERROR);
        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                log.error("API 请求超时: {}", url);
                return fallback(FetchStatus.TIMEOUT);
            }
            log.error("API 请求失败: {}", e.getMessage());
            return fallback(FetchStatus.TRANSPORT_ERROR);
        } catch (RestClientException e) {
            log.error("API 请求失败: {}", e.getMessage());
            return fallback(FetchStatus.TRANSPORT_ERROR);
        } catch (Exception e) {
            // JSON 解析等其他错误
            log.error("处理 API 响应时发生未知错误: {}", e.toString());
            return fallback(FetchStatus.DECODE_ERROR);
        }
    }

    /** 字段缺省时取默认值；整体不是对象或 impression 不是整数视为解析错误 */
    private AffinityFetchResult decode(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            throw new IllegalStateException("empty response body");
        }
        JsonNode root = mapper.readTree(body);
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("response is not a json object");
        }

        int impression = AffinityFetchResult.DEFAULT_IMPRESSION;
        JsonNode imp = root.get("impression");
        if (imp != null && !imp.isNull()) {
            if (!imp.isIntegralNumber() || !imp.canConvertToInt()) {
                throw new IllegalStateException("impression is not an integer: " + imp);
            }
            impression = imp.intValue();
        }

        String attitude = api.getDefaultAttitude();
        JsonNode att = root.get("attitude");
        if (att != null && !att.isNull()) {
            if (!att.isValueNode()) {
                throw new IllegalStateException("attitude is not a string: " + att);
            }
            attitude = att.asText();
        }
        return AffinityFetchResult.success(impression, attitude);
    }

    private AffinityFetchResult fallback(FetchStatus status) {
        return AffinityFetchResult.fallback(status, api.getDefaultAttitude());
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            // JdkClientHttpRequest 把读超时包成 IOException("Request timed out")，cause 为 TimeoutException
            if (t instanceof HttpTimeoutException
                    || t instanceof SocketTimeoutException
                    || t instanceof TimeoutException) return true;
            if (t.getCause() == t) break;
        }
        return false;
    }

    private static String stripTrailingSlash(String url) {
        String s = url == null ? "" : url.trim();
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        return s;
    }
}
