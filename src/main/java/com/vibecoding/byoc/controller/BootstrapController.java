package com.vibecoding.byoc.controller;

import com.vibecoding.byoc.bootstrap.BootstrapRequest;
import com.vibecoding.byoc.bootstrap.BootstrapResult;
import com.vibecoding.byoc.bootstrap.ByocBootstrapService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * BYOC 컨트롤 플레인 리소스 일괄 생성 / 삭제 API
 */
@RestController
@RequestMapping("/api/bootstrap")
@RequiredArgsConstructor
public class BootstrapController {

    private static final Logger log = LoggerFactory.getLogger(BootstrapController.class);

    private final ByocBootstrapService bootstrapService;

    @PostMapping
    public BootstrapResult bootstrap(@RequestBody BootstrapRequest request) {
        log.info("API: bootstrap {} / {}", request.getCloud(), request.getRegion());
        return bootstrapService.bootstrap(request);
    }

    @PostMapping("/teardown")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void teardown(@RequestBody BootstrapResult result) {
        log.info("API: teardown {}", result.getCellName());
        bootstrapService.teardown(result);
    }
}
