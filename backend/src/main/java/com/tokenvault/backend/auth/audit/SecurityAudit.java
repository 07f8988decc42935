package com.tokenvault.backend.auth.audit;

import java.util.List;
import java.util.function.Consumer;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * 감사 호출 진입점
 *
 * - 등록된 SecurityAuditSink 전부에게 이벤트를 전달한다.
 * - sink 하나가 실패해도 경고 로그만 남기고 다음 sink / 호출자 흐름은 계속 진행
 *   (감사 실패가 로그인/재발급/로그아웃을 실패시키면 안 됨)
 */
@Slf4j
@Component
public class SecurityAudit {

    private final List<SecurityAuditSink> sinks;

    public SecurityAudit(List<SecurityAuditSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public void record(Consumer<SecurityAuditSink> event) {
        for (SecurityAuditSink sink : sinks) {
            try {
                event.accept(sink);
            } catch (RuntimeException e) {
                log.warn("Security audit sink {} failed", sink.getClass().getSimpleName(), e);
            }
        }
    }
}
