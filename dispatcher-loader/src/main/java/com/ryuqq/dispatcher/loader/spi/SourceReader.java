package com.ryuqq.dispatcher.loader.spi;

/**
 * 단일 위치(파일 경로 또는 URL)의 데이터를 읽는 SPI.
 *
 * <p>파일 포맷 파싱과 네트워크 조회는 이 구현체의 책임입니다.
 * I/O 오류는 {@link java.io.UncheckedIOException} 등 unchecked 예외로 전파해야 합니다.</p>
 *
 * @param <T> 읽은 데이터 타입
 * @author Dispatcher Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SourceReader<T> {

    /**
     * 위치의 데이터 읽기.
     *
     * @param location 파일 경로 또는 URL
     * @return 읽은 데이터
     */
    T read(String location);
}
