package com.axcockpit.backend.api;

import com.axcockpit.backend.config.CockpitProps;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** X-Actor 헤더가 없으면 설정된 기본 사용자 */
@Component
@RequiredArgsConstructor
public class RequestActor {

    public static final String HEADER = "X-Actor";

    private final CockpitProps props;

    public String resolve(String header) {
        if (header == null || header.isBlank()) {
            return props.getAudit().getDefaultActor();
        }
        return header.trim();
    }
}
