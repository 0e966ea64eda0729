package com.jz.injector.affinity.fetch;

import java.util.concurrent.CompletableFuture;

/** 查询远端好感度：永远返回结果，从不抛异常 */
public interface AffinityFetcher {

    AffinityFetchResult fetch(String userId);

    CompletableFuture<AffinityFetchResult> fetchAsync(String userId);
}
