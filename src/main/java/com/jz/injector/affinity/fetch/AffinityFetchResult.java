package com.jz.injector.affinity.fetch;

import lombok.Value;

/**
 * 一次好感度查询的结果。失败时 impression/attitude 为默认值，
 * 因此调用方可以不看 status 直接使用。
 */
@Value
public class AffinityFetchResult {
    public static final int DEFAULT_IMPRESSION = 0;

    FetchStatus status;
    int impression;
    String attitude;

    public static AffinityFetchResult success(int impression, String attitude) {
        return new AffinityFetchResult(FetchStatus.SUCCESS, impression, attitude);
    }

    public static AffinityFetchResult fallback(FetchStatus status, String defaultAttitude) {
        return new AffinityFetchResult(status, DEFAULT_IMPRESSION, defaultAttitude);
    }
}
