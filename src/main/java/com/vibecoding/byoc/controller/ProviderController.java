package com.vibecoding.byoc.controller;

import com.vibecoding.byoc.provider.CreateResult;
import com.vibecoding.byoc.provider.DiffResult;
import com.vibecoding.byoc.provider.ProviderRegistry;
import com.vibecoding.byoc.provider.ResourceKind;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 리소스 프로바이더 라이프사이클 API
 * kind는 kebab-case 이름 (environment, cpgw-api-key, project-api-key ...)
 */
@RestController
@RequestMapping("/api/providers/{kind}")
@RequiredArgsConstructor
public class ProviderController {

    private static final Logger log = LoggerFactory.getLogger(ProviderController.class);

    private final ProviderRegistry registry;

    @PostMapping("/create")
    public CreateResult<Map<String, Object>> create(@PathVariable String kind, @RequestBody ProviderRequest request) {
        log.info("API: create {}", kind);
        return registry.create(ResourceKind.fromWireName(kind), request.getInputs());
    }

    @PostMapping("/diff")
    public DiffResult diff(@PathVariable String kind, @RequestBody ProviderRequest request) {
        return registry.diff(ResourceKind.fromWireName(kind), requireId(request), request.getOlds(), request.getNews());
    }

    @PostMapping("/update")
    public Map<String, Object> update(@PathVariable String kind, @RequestBody ProviderRequest request) {
        log.info("API: update {} {}", kind, request.getId());
        Map<String, Object> outputs = registry.update(
            ResourceKind.fromWireName(kind), requireId(request), request.getOlds(), request.getNews());
        return Map.of("outputs", outputs);
    }

    @PostMapping("/delete")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String kind, @RequestBody ProviderRequest request) {
        log.info("API: delete {} {}", kind, request.getId());
        registry.delete(ResourceKind.fromWireName(kind), requireId(request), request.getProps());
    }

    private static String requireId(ProviderRequest request) {
        if (request.getId() == null || request.getId().isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        return request.getId();
    }
}
