package com.mydetail.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * 문제 코드(code)와 사용자용 상세 메시지를 함께 전달하는 HTTP 예외.
 * 코드는 {@code role.not_found}, {@code catalog.unknown_module} 처럼 모듈 접두어를 붙인다.
 */
public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detail;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null);
    }

    public ProblemException(HttpStatus status, String code, String detail, Throwable cause) {
        super(status, code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }
}
