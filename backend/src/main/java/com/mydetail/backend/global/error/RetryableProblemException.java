package com.mydetail.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * 잠시 후 다시 시도하면 성공할 수 있는 실패. 응답에 {@code Retry-After} 헤더가 붙는다.
 */
public class RetryableProblemException extends ProblemException {

    static final String PERMISSIONS_UNAVAILABLE = "permissions.unavailable";
    static final String PERMISSIONS_UNAVAILABLE_DETAIL = "permissions could not be loaded, contact support";
    static final int PERMISSIONS_RETRY_AFTER_SECONDS = 5;

    private final int retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, int retryAfterSeconds, Throwable cause) {
        super(status, code, detail, cause);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    /**
     * 권한을 불러오지 못한 요청. 권한 없음과 같게 취급되며 사용자에게는 고정 문구만 보인다.
     */
    public static RetryableProblemException permissionsUnavailable(Throwable cause) {
        return new RetryableProblemException(HttpStatus.SERVICE_UNAVAILABLE, PERMISSIONS_UNAVAILABLE,
                PERMISSIONS_UNAVAILABLE_DETAIL, PERMISSIONS_RETRY_AFTER_SECONDS, cause);
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
