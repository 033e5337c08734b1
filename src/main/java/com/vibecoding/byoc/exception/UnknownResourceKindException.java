package com.vibecoding.byoc.exception;

/**
 * 등록되지 않은 리소스 종류 요청
 */
public class UnknownResourceKindException extends RuntimeException {

    public UnknownResourceKindException(String kind) {
        super("Unknown resource kind: " + kind);
    }
}
