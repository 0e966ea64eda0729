package com.jz.injector.affinity.fetch;

/** 好感度接口调用结果分类，失败类别只用于排查，调用方拿到的都是默认值 */
public enum FetchStatus {
    SUCCESS,
    /** 请求超时 */
    TIMEOUT,
    /** 连接失败或非 2xx 状态码 */
    TRANSPORT_ERROR,
    /** 响应体不是合法的 JSON 对象 */
    DECODE_ERROR;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
