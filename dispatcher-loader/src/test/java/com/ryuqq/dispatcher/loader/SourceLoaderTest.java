package com.ryuqq.dispatcher.loader;

import com.ryuqq.dispatcher.core.contract.Arguments;
import com.ryuqq.dispatcher.core.error.NoMatchingSignatureException;
import com.ryuqq.dispatcher.core.error.NoSatisfiedConditionException;
import com.ryuqq.dispatcher.loader.spi.RangeQuery;
import com.ryuqq.dispatcher.loader.spi.SourceReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * SourceLoader 라우팅 테스트.
 *
 * <p>입력 형태별로 선택되는 로더를 검증합니다:</p>
 * <ul>
 *   <li>파일 → 단일 값</li>
 *   <li>디렉터리, glob, 파일 목록 → 목록</li>
 *   <li>하나에만 일치하는 위치 인자 glob → 단일 값</li>
 *   <li>그 외 문자열 → URL</li>
 *   <li>장비 + 구간 → 구간 조회</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class SourceLoaderTest {

    @Mock
    private RangeQuery rangeQuery;

    private InMemoryLocationResolver resolver;
    private List<String> reads;
    private SourceReader<String> reader;
    private SourceLoader<String> loader;

    @BeforeEach
    void setUp() {
        resolver = new InMemoryLocationResolver().withFiles(
            "data/BIR_20110922_103000_01.fit",
            "data/BIR_20110922_101500_01.fit",
            "data/ALASKA_20110922_100000_59.fit",
            "single/only.fit"
        );
        reads = new ArrayList<>();
        reader = location -> {
            reads.add(location);
            return "read:" + location;
        };
        loader = new SourceLoader<>(reader, resolver, rangeQuery, new LoaderConfig());
    }

    @Test
    void create_ExistingFile_ReadsSingleFile() {
        // When
        Object result = loader.create("data/ALASKA_20110922_100000_59.fit");

        // Then
        assertEquals("read:data/ALASKA_20110922_100000_59.fit", result);
    }

    @Test
    void create_Directory_ReadsEntriesInListingOrder() {
        // When
        Object result = loader.create("data");

        // Then
        assertThat(result).isInstanceOf(List.class);
        assertThat(reads).containsExactly(
            "data/BIR_20110922_103000_01.fit",
            "data/BIR_20110922_101500_01.fit",
            "data/ALASKA_20110922_100000_59.fit"
        );
    }

    @Test
    void create_DirectoryWithSortByLocation_ReadsEntriesSorted() {
        // Given
        SourceLoader<String> sorted = new SourceLoader<>(
            reader, resolver, rangeQuery, new LoaderConfig().withSortByLocation(true)
        );

        // When
        sorted.create("data");

        // Then
        assertThat(reads).containsExactly(
            "data/ALASKA_20110922_100000_59.fit",
            "data/BIR_20110922_101500_01.fit",
            "data/BIR_20110922_103000_01.fit"
        );
    }

    @Test
    void create_GlobMatchingSeveral_ReturnsList() {
        // When
        Object result = loader.create("data/BIR_*.fit");

        // Then
        assertEquals(
            List.of("read:data/BIR_20110922_103000_01.fit", "read:data/BIR_20110922_101500_01.fit"),
            result
        );
    }

    @Test
    void create_GlobMatchingOne_ReturnsSingleValue() {
        // When
        Object result = loader.create("single/*.fit");

        // Then
        assertEquals("read:single/only.fit", result);
    }

    @Test
    void create_NamedPatternMatchingOne_ReturnsList() {
        // When
        Object result = loader.create(Arguments.builder().put("pattern", "single/*.fit").build());

        // Then
        assertEquals(List.of("read:single/only.fit"), result);
    }

    @Test
    void create_NamedPatternAsListAndMap_ReturnsList() {
        // When
        Object result = loader.create(List.of(), Map.of("pattern", "single/*.fit"));

        // Then
        assertEquals(List.of("read:single/only.fit"), result);
    }

    @Test
    void create_GlobCondition_ResolvesPatternOncePerCondition() {
        // Given
        List<String> globCalls = new ArrayList<>();
        InMemoryLocationResolver counting = new InMemoryLocationResolver() {
            @Override
            public List<String> glob(String pattern) {
                globCalls.add(pattern);
                return super.glob(pattern);
            }
        }.withFiles("data/a.fit", "data/b.fit");
        SourceLoader<String> counted = new SourceLoader<>(reader, counting, rangeQuery, new LoaderConfig());

        // When
        counted.create("data/*.fit");

        // Then: isSingleGlob 1회, isGlob 1회, fromGlob 1회
        assertThat(globCalls).hasSize(3).containsOnly("data/*.fit");
    }

    @Test
    void create_NamedPatternMatchingNothing_ThrowsNoSatisfiedCondition() {
        assertThrows(
            NoSatisfiedConditionException.class,
            () -> loader.create(Arguments.builder().put("pattern", "missing/*.fit").build())
        );
    }

    @Test
    void create_FileCollection_KeepsGivenOrder() {
        // When
        Object result = loader.create(List.of("b.fit", "a.fit"));

        // Then
        assertEquals(List.of("read:b.fit", "read:a.fit"), result);
    }

    @Test
    void create_FileCollectionWithSortByLocation_ReadsEachSorted() {
        // Given
        SourceLoader<String> sorted = new SourceLoader<>(
            reader, resolver, rangeQuery, new LoaderConfig().withSortByLocation(true)
        );

        // When
        Object result = sorted.create(List.of("b.fit", "a.fit"));

        // Then
        assertEquals(List.of("read:a.fit", "read:b.fit"), result);
    }

    @Test
    void readMany_WithResultComparator_SortsByLoadedValue() {
        // Given: 읽은 결과의 길이로 정렬
        SourceReader<String> sized = location -> location.substring(location.indexOf(':') + 1);
        SourceLoader<String> byResult = new SourceLoader<>(sized, resolver, rangeQuery, new LoaderConfig());

        // When
        List<String> result = byResult.readMany(
            List.of("x:ccc", "y:a", "z:bb"),
            Comparator.comparingInt(String::length)
        );

        // Then
        assertEquals(List.of("a", "bb", "ccc"), result);
    }

    @Test
    void readMany_NullComparator_KeepsGivenOrder() {
        // When
        List<String> result = loader.readMany(List.of("c.fit", "a.fit", "b.fit"), null);

        // Then
        assertEquals(List.of("read:c.fit", "read:a.fit", "read:b.fit"), result);
        assertThrows(UnsupportedOperationException.class, () -> result.add("d"));
    }

    @Test
    void create_CollectionWithNonString_ThrowsException() {
        assertThatThrownBy(() -> loader.create(List.of("a.fit", 3)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("only strings");
    }

    @Test
    void create_UnknownString_FallsBackToUrl() {
        // When
        Object result = loader.create("http://example.org/BIR_20110922_103000_01.fit");

        // Then
        assertEquals("read:http://example.org/BIR_20110922_103000_01.fit", result);
    }

    @Test
    void create_NamedUrl_ReadsUrl() {
        // When
        Object result = loader.create(Arguments.builder().put("url", "http://example.org/a.fit").build());

        // Then
        assertEquals("read:http://example.org/a.fit", result);
    }

    @Test
    void create_InstrumentAndRange_ReadsLocatedUrls() {
        // Given
        Instant start = Instant.parse("2011-09-22T10:30:00Z");
        Instant end = Instant.parse("2011-09-22T11:00:00Z");
        when(rangeQuery.locate("BIR", start, end))
            .thenReturn(List.of("http://example.org/2.fit", "http://example.org/1.fit"));

        // When
        Object result = loader.create("BIR", "2011-09-22T10:30:00Z", end);

        // Then
        assertEquals(List.of("read:http://example.org/2.fit", "read:http://example.org/1.fit"), result);
        verify(rangeQuery).locate("BIR", start, end);
    }

    @Test
    void create_RangeStartAfterEnd_ThrowsException() {
        // When & Then
        assertThrows(
            IllegalArgumentException.class,
            () -> loader.create("BIR", "2011-09-22T11:00:00Z", "2011-09-22T10:30:00Z")
        );
        verify(rangeQuery, never()).locate(any(), any(), any());
    }

    @Test
    void create_RangeWithUnparsableTime_ThrowsException() {
        assertThatThrownBy(() -> loader.create("BIR", "yesterday", "2011-09-22T10:30:00Z"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("start");
    }

    @Test
    void create_UnsupportedInputType_ThrowsNoMatchingSignature() {
        assertThrows(NoMatchingSignatureException.class, () -> loader.create(42));
    }

    @Test
    void create_NoArguments_ThrowsNoMatchingSignature() {
        assertThrows(NoMatchingSignatureException.class, () -> loader.create());
    }

    @Test
    void create_CustomWildcard_TreatsPlainStarAsUrl() {
        // Given
        SourceLoader<String> custom = new SourceLoader<>(
            reader, resolver, rangeQuery, new LoaderConfig().withWildcard("%")
        );

        // When
        Object result = custom.create("data/BIR_*.fit");

        // Then
        assertEquals("read:data/BIR_*.fit", result);
    }

    @Test
    void fromSingleGlob_NoMatch_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> loader.fromSingleGlob("none/*.fit"));
    }

    @Test
    void constructor_NullDependency_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new SourceLoader<>(null, resolver, rangeQuery, new LoaderConfig()));
        assertThrows(IllegalArgumentException.class,
            () -> new SourceLoader<>(reader, null, rangeQuery, new LoaderConfig()));
        assertThrows(IllegalArgumentException.class,
            () -> new SourceLoader<>(reader, resolver, null, new LoaderConfig()));
        assertThrows(IllegalArgumentException.class,
            () -> new SourceLoader<>(reader, resolver, rangeQuery, null));
    }

    @Test
    void read_NullLocation_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> loader.read(null));
    }
}
