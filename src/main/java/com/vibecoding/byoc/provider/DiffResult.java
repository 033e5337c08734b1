package com.vibecoding.byoc.provider;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * diff 결과
 * - changes: 변경 여부
 * - replaces: 교체를 유발하는 필드 (비어 있으면 in-place update)
 * - stables: 변경되지 않음이 보장되는 출력 필드
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DiffResult {
    private boolean changes;

    @Builder.Default
    private List<String> replaces = new ArrayList<>();

    @Builder.Default
    private List<String> stables = new ArrayList<>();

    private boolean deleteBeforeReplace;

    /**
     * 기록된 상태가 손상된 경우 강제 교체
     */
    public static DiffResult forceReplace(String field) {
        return DiffResult.builder()
            .changes(true)
            .replaces(new ArrayList<>(List.of(field)))
            .deleteBeforeReplace(true)
            .build();
    }

    public static DiffResult replacing(List<String> replaces, List<String> stables) {
        return DiffResult.builder()
            .changes(!replaces.isEmpty())
            .replaces(replaces)
            .stables(stables)
            .deleteBeforeReplace(true)
            .build();
    }

    public boolean isReplace() {
        return !replaces.isEmpty();
    }
}
