package com.vibecoding.byoc.provider;

import com.vibecoding.byoc.exception.ClusterUninstallException;
import com.vibecoding.byoc.model.ClusterUninstallerProps;
import com.vibecoding.byoc.uninstall.UninstallJobRunner;
import com.vibecoding.byoc.uninstall.UninstallPhase;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 클러스터 언인스톨러
 * create는 아무 일도 하지 않고, delete 시점에 클러스터 안에서 언인스톨 Job을 실행
 */
@Component
@RequiredArgsConstructor
public class ClusterUninstallerProvider implements ResourceProvider<ClusterUninstallerProps> {

    private static final Logger log = LoggerFactory.getLogger(ClusterUninstallerProvider.class);

    static final String READY_ID = "uninstaller-ready";

    private final UninstallJobRunner runner;

    @Override
    public ResourceKind kind() {
        return ResourceKind.CLUSTER_UNINSTALLER;
    }

    @Override
    public Class<ClusterUninstallerProps> propsType() {
        return ClusterUninstallerProps.class;
    }

    @Override
    public CreateResult<ClusterUninstallerProps> create(ClusterUninstallerProps inputs) {
        return CreateResult.of(READY_ID, inputs);
    }

    /**
     * 입력 변경은 기록만 갱신 (교체 없음)
     */
    @Override
    public DiffResult diff(String id, ClusterUninstallerProps olds, ClusterUninstallerProps news) {
        boolean changed = ProviderSupport.differs(olds.getKubeconfig(), news.getKubeconfig())
            || ProviderSupport.differs(olds.getPinetoolsImage(), news.getPinetoolsImage())
            || ProviderSupport.differs(olds.getCloud(), news.getCloud());
        return DiffResult.builder().changes(changed).build();
    }

    @Override
    public void delete(String id, ClusterUninstallerProps props) {
        if (!ProviderSupport.allPresent(props.getKubeconfig())) {
            throw new ClusterUninstallException("kubeconfig not provided to uninstaller");
        }
        if (!ProviderSupport.allPresent(props.getPinetoolsImage())) {
            throw new ClusterUninstallException("pinetools_image not provided to uninstaller");
        }

        UninstallPhase phase = runner.run(props.getKubeconfig(), props.getPinetoolsImage(), props.getCloud());
        log.info("Cluster uninstall finished: {}", phase);
    }
}
