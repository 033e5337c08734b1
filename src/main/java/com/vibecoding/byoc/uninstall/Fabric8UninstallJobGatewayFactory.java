package com.vibecoding.byoc.uninstall;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.springframework.stereotype.Component;

@Component
public class Fabric8UninstallJobGatewayFactory implements UninstallJobGatewayFactory {

    @Override
    public UninstallJobGateway open(Config config) {
        return new Fabric8UninstallJobGateway(new KubernetesClientBuilder().withConfig(config).build());
    }
}
