package com.mydetail.backend.modules.permission.application;

import com.mydetail.backend.modules.permission.domain.PermissionErrorKind;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

/**
 * 저장소 예외를 엔진 오류 분류로 옮긴다.
 */
public final class StorageFailures {

    private StorageFailures() {
    }

    public static PermissionErrorKind classify(Throwable failure) {
        if (failure instanceof QueryTimeoutException
                || failure instanceof TransientDataAccessException
                || failure instanceof DataAccessResourceFailureException
                || failure instanceof RecoverableDataAccessException) {
            return PermissionErrorKind.DEPENDENCY_UNAVAILABLE;
        }
        return PermissionErrorKind.UNEXPECTED;
    }
}
