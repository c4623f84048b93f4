package com.team.qametrics.service.dashboard;

import lombok.Getter;

/**
 * 後端回傳的 JSON 無法解析成預期的結構。
 */
@Getter
public class MetricsPayloadException extends RuntimeException {

    /** 資料種類，例如 "bug summary"、"employees" */
    private final String payloadKind;

    public MetricsPayloadException(String payloadKind, Throwable cause) {
        super("Failed to parse " + payloadKind + " payload: " + cause.getMessage(), cause);
        this.payloadKind = payloadKind;
    }
}
