package com.vibecoding.byoc.provider;

import com.vibecoding.byoc.exception.UnknownResourceKindException;

/**
 * 엔진이 관리하는 외부 리소스 종류
 */
public enum ResourceKind {
    ENVIRONMENT("environment"),
    CPGW_API_KEY("cpgw-api-key"),
    SERVICE_ACCOUNT("service-account"),
    PROJECT_API_KEY("project-api-key"),
    DNS_DELEGATION("dns-delegation"),
    AMP_ACCESS("amp-access"),
    DATADOG_API_KEY("datadog-api-key"),
    CLUSTER_UNINSTALLER("cluster-uninstaller");

    private final String wireName;

    ResourceKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static ResourceKind fromWireName(String name) {
        for (ResourceKind kind : values()) {
            if (kind.wireName.equals(name)) {
                return kind;
            }
        }
        throw new UnknownResourceKindException(name);
    }
}
