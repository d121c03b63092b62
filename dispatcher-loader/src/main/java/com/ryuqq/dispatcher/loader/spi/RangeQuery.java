package com.ryuqq.dispatcher.loader.spi;

import java.time.Instant;
import java.util.List;

/**
 * 관측 장비와 시간 구간으로 데이터 위치(URL)를 찾는 SPI.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RangeQuery {

    /**
     * 구간 내 데이터 위치 조회.
     *
     * @param instrument 관측 장비 이름
     * @param start 구간 시작 (포함)
     * @param end 구간 끝
     * @return 데이터 위치 목록
     */
    List<String> locate(String instrument, Instant start, Instant end);
}
