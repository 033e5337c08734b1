package com.vibecoding.byoc.uninstall;

import io.fabric8.kubernetes.client.Config;

public interface UninstallJobGatewayFactory {

    UninstallJobGateway open(Config config);
}
