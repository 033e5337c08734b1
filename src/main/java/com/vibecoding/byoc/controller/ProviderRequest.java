package com.vibecoding.byoc.controller;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 엔진이 보내는 프로바이더 호출 본문
 * - create: inputs
 * - diff / update: id, olds, news
 * - delete: id, props
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderRequest {
    private String id;
    private Map<String, Object> inputs;
    private Map<String, Object> olds;
    private Map<String, Object> news;
    private Map<String, Object> props;
}
