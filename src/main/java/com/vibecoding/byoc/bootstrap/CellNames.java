package com.vibecoding.byoc.bootstrap;

import java.util.Locale;

/**
 * 셀 이름 규칙: {정제된 조직명 16자}-byoc-{환경 이름 첫 라벨의 마지막 4자}
 * 예) "Acme Corp" + "prod-ab12.byoc" -> "acmecorp-byoc-ab12"
 */
public final class CellNames {

    static final int ORG_NAME_MAX_LENGTH = 16;

    private CellNames() {
    }

    public static String cellName(String orgName, String envName) {
        if (orgName == null || envName == null || envName.isBlank()) {
            throw new IllegalArgumentException("org_name and env_name are required to derive a cell name");
        }
        String sanitized = orgName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        if (sanitized.length() > ORG_NAME_MAX_LENGTH) {
            sanitized = sanitized.substring(0, ORG_NAME_MAX_LENGTH);
        }

        String firstLabel = envName.split("\\.", 2)[0];
        String suffix = firstLabel.length() > 4 ? firstLabel.substring(firstLabel.length() - 4) : firstLabel;
        return sanitized + "-byoc-" + suffix;
    }

    public static String serviceAccountName(String cellName) {
        return cellName + "-sa";
    }

    public static String apiKeyName(String cellName) {
        return cellName + "-key";
    }

    /**
     * DNS 위임 서브도메인: 환경 이름에서 ".byoc" 접미사 제거
     */
    public static String subdomain(String envName) {
        return envName.endsWith(".byoc") ? envName.substring(0, envName.length() - ".byoc".length()) : envName;
    }
}
