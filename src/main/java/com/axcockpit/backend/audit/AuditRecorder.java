package com.axcockpit.backend.audit;

/**
 * 감사 로그 수집기. 변경과 같은 트랜잭션 안에서 동기 호출되며, 변경 1건당 정확히 1번 호출된다.
 * 예외를 던지면 호출한 트랜잭션 전체가 롤백된다.
 */
public interface AuditRecorder {

    void record(AuditRecord entry);
}
