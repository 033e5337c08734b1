package com.vibecoding.byoc.provider;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * create 결과: 리소스 ID와 기록할 출력값
 */
@Data
@NoArgsConstructor
@AllArgsConstructor(staticName = "of")
public class CreateResult<P> {
    private String id;
    private P outputs;
}
