package com.vibecoding.byoc.provider;

import com.vibecoding.byoc.exception.ControlPlaneApiException;
import org.slf4j.Logger;

import java.util.Collection;
import java.util.Objects;

/**
 * 프로바이더 공통 헬퍼
 */
final class ProviderSupport {

    private ProviderSupport() {
    }

    /**
     * 모든 값이 존재하는지 확인 (null, 빈 문자열, 빈 컬렉션은 누락)
     */
    static boolean allPresent(Object... values) {
        for (Object value : values) {
            if (value == null) {
                return false;
            }
            if (value instanceof String && ((String) value).isBlank()) {
                return false;
            }
            if (value instanceof Collection && ((Collection<?>) value).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    static boolean differs(Object a, Object b) {
        return !Objects.equals(a, b);
    }

    /**
     * 원격 delete 호출. 404는 이미 삭제된 것으로 보고 성공 처리
     */
    static void deleteIgnoringNotFound(Logger log, String description, Runnable deleteCall) {
        try {
            deleteCall.run();
        } catch (ControlPlaneApiException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            log.warn("{} not found, treating as already deleted", description);
        }
    }
}
