package com.vibecoding.byoc.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 다단계 create의 보상 작업 목록
 * 실패 시 등록의 역순으로 실행하고, 보상 작업의 오류는 원래 예외에 suppressed로 첨부
 */
public class CompensationActions {

    private static final Logger log = LoggerFactory.getLogger(CompensationActions.class);

    private final Deque<Action> actions = new ArrayDeque<>();

    public void register(String description, Runnable action) {
        actions.push(new Action(description, action));
    }

    /**
     * 등록된 보상 작업을 모두 실행. 원래 예외는 그대로 유지
     */
    public void compensate(Throwable original) {
        while (!actions.isEmpty()) {
            Action action = actions.pop();
            try {
                log.warn("Compensating: {}", action.description);
                action.runnable.run();
            } catch (RuntimeException e) {
                log.warn("Compensation '{}' failed: {}", action.description, e.getMessage());
                original.addSuppressed(e);
            }
        }
    }

    private static final class Action {
        private final String description;
        private final Runnable runnable;

        private Action(String description, Runnable runnable) {
            this.description = description;
            this.runnable = runnable;
        }
    }
}
