package com.vibecoding.byoc.uninstall;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 폴링 시점의 Job 상태 카운터
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSnapshot {
    private int active;
    private int succeeded;
    private int failed;
}
