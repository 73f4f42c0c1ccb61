package org.brown.sitepool.site;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * 할당된 테스트 사이트 핸들
 *
 * 슬롯 번호와 사이트 이름, 백엔드 식별자(컨테이너 ID), 접속 주소를 가진다.
 * 테스트가 끝나면 핸들 자체는 파괴되지 않고 슬롯 번호만 풀에 반환된다.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
public class Site {

    /**
     * 슬롯 번호 (1..N)
     */
    private final int slotIndex;

    /**
     * 사이트 이름 (prefix + slotIndex)
     */
    private final String name;

    /**
     * 사이트를 호스팅하는 컨테이너 ID
     */
    private final String containerId;

    /**
     * 기본 바인딩 URL (예: http://localhost:49153)
     */
    private final String primaryBinding;

    @Override
    public String toString() {
        return String.format("Site[slot=%d, name=%s, binding=%s]", slotIndex, name, primaryBinding);
    }
}
