package com.vibecoding.byoc.client;

import java.time.Duration;

/**
 * 재시도 백오프와 Job 폴링에서 쓰는 대기 함수
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
