package com.vibecoding.byoc.provider;

/**
 * 리소스 라이프사이클 계약 (create / diff / update / delete)
 *
 * @param <P> 입력과 기록된 상태를 함께 담는 props 타입
 */
public interface ResourceProvider<P> {

    ResourceKind kind();

    Class<P> propsType();

    /**
     * 원격 create 엔드포인트를 정확히 한 번 호출. 중복 호출 방지는 엔진의 상태 추적이 담당
     */
    CreateResult<P> create(P inputs);

    /**
     * 기록된 상태(olds)와 새 입력(news) 비교
     */
    DiffResult diff(String id, P olds, P news);

    /**
     * 원격에서 부분 수정이 불가능하므로 기본은 새 입력을 그대로 반환
     */
    default P update(String id, P olds, P news) {
        return news;
    }

    /**
     * 이미 삭제된 리소스는 성공으로 간주
     */
    void delete(String id, P props);
}
