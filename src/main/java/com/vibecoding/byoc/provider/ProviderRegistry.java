package com.vibecoding.byoc.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.byoc.exception.UnknownResourceKindException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 리소스 종류별 프로바이더 디스패처
 * 엔진이 보내는 JSON 맵을 프로바이더의 props 타입으로 변환해 호출
 */
@Component
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final Map<ResourceKind, ResourceProvider<?>> providers = new EnumMap<>(ResourceKind.class);
    private final ObjectMapper objectMapper;

    public ProviderRegistry(List<ResourceProvider<?>> providers, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        for (ResourceProvider<?> provider : providers) {
            ResourceProvider<?> previous = this.providers.put(provider.kind(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider for " + provider.kind());
            }
        }
        log.info("Registered {} resource providers: {}", this.providers.size(), this.providers.keySet());
    }

    @SuppressWarnings("unchecked")
    public <P> ResourceProvider<P> get(ResourceKind kind) {
        ResourceProvider<?> provider = providers.get(kind);
        if (provider == null) {
            throw new UnknownResourceKindException(kind.getWireName());
        }
        return (ResourceProvider<P>) provider;
    }

    public CreateResult<Map<String, Object>> create(ResourceKind kind, Map<String, Object> inputs) {
        log.info("create {}", kind.getWireName());
        return doCreate(get(kind), inputs);
    }

    public DiffResult diff(ResourceKind kind, String id, Map<String, Object> olds, Map<String, Object> news) {
        log.debug("diff {} {}", kind.getWireName(), id);
        return doDiff(get(kind), id, olds, news);
    }

    public Map<String, Object> update(ResourceKind kind, String id, Map<String, Object> olds, Map<String, Object> news) {
        log.info("update {} {}", kind.getWireName(), id);
        return doUpdate(get(kind), id, olds, news);
    }

    public void delete(ResourceKind kind, String id, Map<String, Object> props) {
        log.info("delete {} {}", kind.getWireName(), id);
        doDelete(get(kind), id, props);
    }

    private <P> CreateResult<Map<String, Object>> doCreate(ResourceProvider<P> provider, Map<String, Object> inputs) {
        CreateResult<P> result = provider.create(toProps(provider, inputs));
        return CreateResult.of(result.getId(), toMap(result.getOutputs()));
    }

    private <P> DiffResult doDiff(ResourceProvider<P> provider, String id,
                                  Map<String, Object> olds, Map<String, Object> news) {
        return provider.diff(id, toProps(provider, olds), toProps(provider, news));
    }

    private <P> Map<String, Object> doUpdate(ResourceProvider<P> provider, String id,
                                             Map<String, Object> olds, Map<String, Object> news) {
        return toMap(provider.update(id, toProps(provider, olds), toProps(provider, news)));
    }

    private <P> void doDelete(ResourceProvider<P> provider, String id, Map<String, Object> props) {
        provider.delete(id, toProps(provider, props));
    }

    private <P> P toProps(ResourceProvider<P> provider, Map<String, Object> values) {
        return objectMapper.convertValue(values != null ? values : Map.of(), provider.propsType());
    }

    private Map<String, Object> toMap(Object props) {
        return objectMapper.convertValue(props, MAP_TYPE);
    }
}
