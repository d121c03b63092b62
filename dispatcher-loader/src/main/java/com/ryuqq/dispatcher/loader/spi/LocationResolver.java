package com.ryuqq.dispatcher.loader.spi;

import java.util.List;

/**
 * 위치 조회 SPI.
 *
 * <p>파일 시스템 확인, 디렉터리 목록 조회, glob 확장을 담당합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface LocationResolver {

    /**
     * 일반 파일인지 확인.
     *
     * @param location 위치
     * @return 일반 파일이면 true
     */
    boolean isFile(String location);

    /**
     * 디렉터리인지 확인.
     *
     * @param location 위치
     * @return 디렉터리이면 true
     */
    boolean isDirectory(String location);

    /**
     * 디렉터리의 직속 항목 위치 목록.
     *
     * @param directory 디렉터리
     * @return 항목 위치 (디렉터리 경로 포함)
     */
    List<String> list(String directory);

    /**
     * glob 패턴에 일치하는 위치 목록.
     *
     * @param pattern glob 패턴
     * @return 일치하는 위치 (없으면 빈 목록)
     */
    List<String> glob(String pattern);
}
