package com.vibecoding.byoc.uninstall;

import java.util.Optional;

/**
 * exec 기반 kubeconfig 인증을 대체할 단기 토큰 발급
 * 프로바이더 실행 환경은 셸의 credential helper 상태를 물려받지 못하므로 주입해서 사용
 */
public interface ExecCredentialRefresher {

    /**
     * @return 새 토큰, 해당 클라우드에서 갱신이 필요 없으면 empty
     */
    Optional<String> refreshToken(String cloud);
}
