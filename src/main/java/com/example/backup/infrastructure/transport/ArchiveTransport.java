package com.example.backup.infrastructure.transport;

import java.util.List;
import java.util.Optional;

/**
 * 아카이브 저장소와 단일 불변 객체(세그먼트/아티팩트/사이드카)를 주고받는 전송 계층
 *
 * 구현체는 상태를 갖지 않으며, 모든 호출은 재시도 가능해야 한다.
 * 실패는 TransientIoException(재시도 대상) 또는 그 외 BackupException 으로 보고한다.
 */
public interface ArchiveTransport {

    /**
     * 객체 저장. 호출이 반환되면 객체는 완전한 형태로 내구성 있게 기록되어 있어야 한다.
     */
    void put(String location, byte[] content);

    /**
     * 객체 읽기
     * @throws ArchiveObjectNotFoundException 객체가 없는 경우
     */
    byte[] get(String location);

    Optional<ArchiveObject> stat(String location);

    default boolean exists(String location) {
        return stat(location).isPresent();
    }

    void delete(String location);

    /**
     * prefix 로 시작하는 객체 위치 목록 (정렬됨)
     */
    List<String> list(String prefix);

    StorageUsage usage();

    /**
     * 로그 출력용 백엔드 설명
     */
    String describe();
}
