package com.nicl.collector.service.source;

import com.nicl.collector.dto.CollectionQuery;
import com.nicl.collector.dto.SourceFetchResult;
import com.nicl.collector.entity.SourceType;
import com.nicl.collector.util.CancellationToken;

/**
 * 뉴스 소스 어댑터 인터페이스
 *
 * 구현체가 반환하는 레코드는 다음을 만족해야 한다.
 * <ul>
 *   <li>최대 {@code limit}개</li>
 *   <li>제목과 원문 링크가 비어 있지 않음</li>
 *   <li>키워드 질의인 경우 제목 또는 요약에 키워드 포함 (대소문자 무시)</li>
 * </ul>
 * 네트워크/파싱 오류는 예외 대신 실패 사유가 담긴 빈 결과로 돌려준다.
 */
public interface NewsSourceAdapter {

    SourceType getSourceType();

    /**
     * @throws com.nicl.collector.exception.CollectionCancelledException
     *         if the token is cancelled at a page boundary
     */
    SourceFetchResult fetch(CollectionQuery query, int limit, CancellationToken token);

    default SourceFetchResult fetch(CollectionQuery query, int limit) {
        return fetch(query, limit, CancellationToken.NONE);
    }

    /**
     * 소스 접근 가능 여부. 예외를 던지지 않는다.
     */
    boolean validate();
}
