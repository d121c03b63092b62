package com.ryuqq.dispatcher.loader;

/**
 * SourceLoader 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>wildcard: glob 패턴 여부를 판단하는 문자열 (기본 "*")</li>
 *   <li>sortByLocation: 여러 위치를 읽을 때 위치 이름순 정렬 여부 (기본 false, 주어진 순서 유지)</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 * @param wildcard glob 판단 문자열 (null 또는 빈 문자열 불가)
 * @param sortByLocation 위치 이름순 정렬 여부
 */
public record LoaderConfig(String wildcard, boolean sortByLocation) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: wildcard="*", sortByLocation=false</p>
     */
    public LoaderConfig() {
        this("*", false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException wildcard가 null이거나 빈 문자열인 경우
     */
    public LoaderConfig {
        if (wildcard == null || wildcard.isEmpty()) {
            throw new IllegalArgumentException("wildcard cannot be null or empty");
        }
    }

    /**
     * wildcard만 변경한 새 인스턴스 생성.
     *
     * @param wildcard 새 glob 판단 문자열
     * @return 새 LoaderConfig 인스턴스
     */
    public LoaderConfig withWildcard(String wildcard) {
        return new LoaderConfig(wildcard, this.sortByLocation);
    }

    /**
     * sortByLocation만 변경한 새 인스턴스 생성.
     *
     * @param sortByLocation 새 정렬 여부
     * @return 새 LoaderConfig 인스턴스
     */
    public LoaderConfig withSortByLocation(boolean sortByLocation) {
        return new LoaderConfig(this.wildcard, sortByLocation);
    }
}
