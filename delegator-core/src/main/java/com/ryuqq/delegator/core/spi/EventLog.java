package com.ryuqq.delegator.core.spi;

import com.ryuqq.delegator.core.event.Event;

import java.util.List;

/**
 * Append-only Event Log SPI.
 *
 * <p>Event Log는 호출 환경(세션/트랜스크립트 저장소 등)이 소유하며,
 * Orchestrator는 읽기 뷰와 추가 기능만 사용합니다.
 * 파일, 데이터베이스, 메모리 등 어떤 저장 매체든 순서와 append-only 의미만 보장하면 됩니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>삭제, 수정, 재정렬 불가</li>
 *   <li>read()는 추가 순서를 그대로 보존한 불변 스냅샷 반환</li>
 *   <li>append()가 반환하는 LogRef의 sequence는 0부터 1씩 증가</li>
 *   <li>동시 append 시에도 각 이벤트는 정확히 한 번, 하나의 위치에 기록</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventLog {

    /**
     * 이벤트를 로그 끝에 추가.
     *
     * @param event 추가할 이벤트
     * @return 추가된 위치
     * @throws IllegalArgumentException event가 null인 경우
     */
    LogRef append(Event event);

    /**
     * 로그 전체를 순서대로 조회.
     *
     * @return 불변 이벤트 목록 (비어있을 수 있음)
     */
    List<Event> read();

    /**
     * 기록된 이벤트 수.
     *
     * @return 이벤트 수
     */
    int size();

    /**
     * 로그가 비어있는지 확인.
     *
     * @return 이벤트가 없으면 true
     */
    default boolean isEmpty() {
        return size() == 0;
    }
}
