package com.yerin.flowq.global.exception;

/**
 * 호출자에게 던지지 않는 예외를 모으는 통로 (마이그레이션 실패, 제거 대상 없음 등).
 */
public interface ExceptionReporter {
    void report(Throwable e);
}
