package com.goormthonuniv.crosscheck.search;

import lombok.Getter;

/**
 * 제공자 조회가 "결과 없음"이 아니라 "조회 자체가 깨짐"일 때 던진다.
 * (I/O 실패, 타임아웃, 2xx 아닌 응답, 깨진 페이로드)
 */
@Getter
public class ProviderException extends RuntimeException {

    private final String label;
    private final Integer status;   // HTTP 상태가 없으면 null

    public ProviderException(String label, Integer status, String message, Throwable cause) {
        super(message, cause);
        this.label = label;
        this.status = status;
    }

    public ProviderException(String label, String message) {
        this(label, null, message, null);
    }
}
