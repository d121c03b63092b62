package com.ryuqq.dispatcher.loader;

import com.ryuqq.dispatcher.core.contract.Arguments;
import com.ryuqq.dispatcher.core.contract.Condition;
import com.ryuqq.dispatcher.core.match.TypeConstraint;
import com.ryuqq.dispatcher.core.reflect.MethodFunction;
import com.ryuqq.dispatcher.core.registry.DispatchRegistry;
import com.ryuqq.dispatcher.core.signature.Param;
import com.ryuqq.dispatcher.core.signature.Signature;
import com.ryuqq.dispatcher.loader.spi.LocationResolver;
import com.ryuqq.dispatcher.loader.spi.RangeQuery;
import com.ryuqq.dispatcher.loader.spi.SourceReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 입력 값의 형태에 따라 알맞은 로더로 라우팅하는 데이터 로딩 Façade.
 *
 * <p>{@link #create(Object...)}는 하나의 {@link DispatchRegistry}를 통해
 * 다음 순서로 로더를 선택합니다:</p>
 * <pre>
 * #  Handler                              Condition                              Types
 * 1  fromFile(filename)                   일반 파일                              [String]
 * 2  fromDirectory(directory)             디렉터리                               [String]
 * 3  fromSingleGlob(singlePattern)        wildcard 포함 + 정확히 1개 일치        [String]
 * 4  fromGlob(pattern)                    wildcard 포함 + 1개 이상 일치          [String]
 * 5  fromFiles(filenames)                 (없음)                                 [Collection]
 * 6  fromUrl(url)                         (없음)                                 [String]
 * 7  fromRange(instrument, start, end)    (없음)                                 [String]
 * </pre>
 *
 * <p>위치 인자로 넘긴 패턴이 하나의 위치에만 일치하면 단일 값을,
 * {@code pattern} 이름 인자로 넘기면 항상 목록을 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SourceLoader&lt;Spectrum&gt; loader = new SourceLoader&lt;&gt;(reader, resolver, rangeQuery, new LoaderConfig());
 *
 * Object one = loader.create("data/BIR_20110922_103000_01.fit");
 * Object many = loader.create("data/");
 * Object range = loader.create("BIR", "2011-09-22T10:30:00Z", "2011-09-22T11:00:00Z");
 * </pre>
 *
 * <p>파일 파싱, 네트워크 조회, 디렉터리/glob 확장은 SPI 구현체에 위임합니다.</p>
 *
 * @param <T> 읽은 데이터 타입
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class SourceLoader<T> {

    private static final Logger log = LoggerFactory.getLogger(SourceLoader.class);

    private final SourceReader<T> reader;
    private final LocationResolver resolver;
    private final RangeQuery rangeQuery;
    private final LoaderConfig config;
    private final DispatchRegistry<Object> registry;

    /**
     * 생성자.
     *
     * @param reader 데이터 읽기 SPI
     * @param resolver 위치 조회 SPI
     * @param rangeQuery 구간 조회 SPI
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SourceLoader(SourceReader<T> reader, LocationResolver resolver, RangeQuery rangeQuery, LoaderConfig config) {
        if (reader == null) {
            throw new IllegalArgumentException("reader cannot be null");
        }
        if (resolver == null) {
            throw new IllegalArgumentException("resolver cannot be null");
        }
        if (rangeQuery == null) {
            throw new IllegalArgumentException("rangeQuery cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.reader = reader;
        this.resolver = resolver;
        this.rangeQuery = rangeQuery;
        this.config = config;
        this.registry = new DispatchRegistry<>("source-loader");
        registerLoaders();
    }

    private void registerLoaders() {
        List<TypeConstraint> string = TypeConstraint.instancesOf(String.class);

        registry.register(
            MethodFunction.bind(this, "fromFile"),
            Condition.of("isFile", Signature.of("filename"),
                p -> resolver.isFile(p.get("filename", String.class))),
            string
        );
        registry.register(
            MethodFunction.bind(this, "fromDirectory"),
            Condition.of("isDirectory", Signature.of("directory"),
                p -> resolver.isDirectory(p.get("directory", String.class))),
            string
        );
        // 위치 인자로 넘긴 패턴이 하나에만 일치하면 목록 대신 단일 값
        registry.register(
            MethodFunction.bind(this, "fromSingleGlob"),
            Condition.of("isSingleGlob", Signature.of("singlePattern"), p -> {
                String pattern = p.get("singlePattern", String.class);
                return isPattern(pattern) && resolver.glob(pattern).size() == 1;
            }),
            string
        );
        registry.register(
            MethodFunction.bind(this, "fromGlob"),
            Condition.of("isGlob", Signature.of("pattern"), p -> {
                String pattern = p.get("pattern", String.class);
                return isPattern(pattern) && !resolver.glob(pattern).isEmpty();
            }),
            string
        );
        registry.register(MethodFunction.bind(this, "fromFiles"), TypeConstraint.instancesOf(Collection.class));
        registry.register(MethodFunction.bind(this, "fromUrl"), string);
        registry.register(MethodFunction.bind(this, "fromRange"), string);

        log.debug("SourceLoader registered {} loaders", registry.size());
    }

    /**
     * 입력 값의 형태에 맞는 로더로 읽기.
     *
     * <p>배열 하나를 넘기면 원소들이 각각의 위치 인자가 됩니다.
     * 파일 목록은 {@link Collection}으로 넘기거나 {@link #create(List, Map)}을 사용합니다.</p>
     *
     * @param args 위치 인자
     * @return 단일 데이터 또는 데이터 목록
     * @throws com.ryuqq.dispatcher.core.error.NoMatchingSignatureException 입력 형태를 받는 로더가 없는 경우
     * @throws com.ryuqq.dispatcher.core.error.NoSatisfiedConditionException 모든 로더 조건이 거부한 경우
     */
    public Object create(Object... args) {
        return create(Arguments.of(args));
    }

    /**
     * 위치 인자와 이름 인자로 읽기.
     *
     * <pre>
     * loader.create(List.of(), Map.of("pattern", "data/*.fit"));
     * </pre>
     *
     * @param positional 위치 인자
     * @param named 이름 인자
     * @return 단일 데이터 또는 데이터 목록
     */
    public Object create(List<?> positional, Map<String, ?> named) {
        return create(Arguments.of(positional, named));
    }

    /**
     * 입력 값의 형태에 맞는 로더로 읽기 (이름 인자 포함).
     *
     * @param arguments 원본 호출 인자
     * @return 단일 데이터 또는 데이터 목록
     */
    public Object create(Arguments arguments) {
        log.info("Loading source for call [{}]", arguments == null ? "null" : arguments.describeShape());
        return registry.invoke(arguments);
    }

    /**
     * 단일 위치 읽기.
     *
     * @param location 파일 경로 또는 URL
     * @return 데이터
     */
    public T read(String location) {
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
        log.debug("Reading {}", location);
        return reader.read(location);
    }

    /**
     * 여러 위치 읽기.
     *
     * <p>기본적으로 주어진 순서(디렉터리 목록, glob 결과, 호출자 목록)대로 읽습니다.
     * {@link LoaderConfig#sortByLocation()}이 true이면 위치 이름순으로 읽습니다.</p>
     *
     * @param locations 위치 목록
     * @return 읽은 데이터 목록 (읽기 전용)
     */
    public List<T> readMany(Collection<String> locations) {
        return readMany(locations, null);
    }

    /**
     * 여러 위치를 읽은 뒤 결과 기준으로 정렬.
     *
     * <pre>
     * loader.readMany(files, Comparator.comparing(Spectrum::start));
     * </pre>
     *
     * @param locations 위치 목록
     * @param sortBy 결과 정렬 기준 (null이면 정렬하지 않음)
     * @return 읽은 데이터 목록 (읽기 전용)
     * @throws IllegalArgumentException locations가 null인 경우
     */
    public List<T> readMany(Collection<String> locations, Comparator<? super T> sortBy) {
        if (locations == null) {
            throw new IllegalArgumentException("locations cannot be null");
        }
        List<String> ordered = new ArrayList<>(locations);
        if (config.sortByLocation()) {
            Collections.sort(ordered);
        }
        List<T> results = new ArrayList<>(ordered.size());
        for (String location : ordered) {
            results.add(read(location));
        }
        if (sortBy != null) {
            results.sort(sortBy);
        }
        return Collections.unmodifiableList(results);
    }

    /**
     * 파일 하나 읽기.
     *
     * @param filename 파일 경로
     * @return 데이터
     */
    public T fromFile(@Param("filename") String filename) {
        return read(filename);
    }

    /**
     * 디렉터리의 모든 항목 읽기.
     *
     * @param directory 디렉터리
     * @return 데이터 목록
     */
    public List<T> fromDirectory(@Param("directory") String directory) {
        return readMany(resolver.list(directory));
    }

    /**
     * glob 패턴에 일치하는 첫 위치 읽기.
     *
     * @param singlePattern glob 패턴
     * @return 데이터
     * @throws IllegalStateException 일치하는 위치가 없는 경우
     */
    public T fromSingleGlob(@Param("singlePattern") String singlePattern) {
        List<String> matches = resolver.glob(singlePattern);
        if (matches.isEmpty()) {
            throw new IllegalStateException("No location matches pattern: " + singlePattern);
        }
        return read(matches.get(0));
    }

    /**
     * glob 패턴에 일치하는 모든 위치 읽기.
     *
     * @param pattern glob 패턴
     * @return 데이터 목록
     */
    public List<T> fromGlob(@Param("pattern") String pattern) {
        return readMany(resolver.glob(pattern));
    }

    /**
     * 여러 파일 읽기.
     *
     * @param filenames 파일 경로 목록 (String 원소만 허용)
     * @return 데이터 목록
     * @throws IllegalArgumentException String이 아닌 원소가 있는 경우
     */
    public List<T> fromFiles(@Param("filenames") Collection<?> filenames) {
        List<String> locations = new ArrayList<>(filenames.size());
        for (Object filename : filenames) {
            if (!(filename instanceof String)) {
                throw new IllegalArgumentException("filenames must contain only strings (found: " + filename + ")");
            }
            locations.add((String) filename);
        }
        return readMany(locations);
    }

    /**
     * URL 읽기.
     *
     * @param url URL
     * @return 데이터
     */
    public T fromUrl(@Param("url") String url) {
        return read(url);
    }

    /**
     * 관측 장비의 구간 데이터를 모두 찾아 읽기.
     *
     * @param instrument 관측 장비 이름
     * @param start 구간 시작 ({@link Instant} 또는 ISO-8601 문자열)
     * @param end 구간 끝 ({@link Instant} 또는 ISO-8601 문자열)
     * @return 데이터 목록 (조회된 순서)
     * @throws IllegalArgumentException 시각을 해석할 수 없거나 start가 end보다 늦은 경우
     */
    public List<T> fromRange(@Param("instrument") String instrument, @Param("start") Object start, @Param("end") Object end) {
        Instant from = toInstant("start", start);
        Instant to = toInstant("end", end);
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("start must not be after end (start: " + from + ", end: " + to + ")");
        }
        List<String> urls = rangeQuery.locate(instrument, from, to);
        log.info("Range query {} [{} ~ {}] located {} sources", instrument, from, to, urls.size());

        List<T> results = new ArrayList<>(urls.size());
        for (String url : urls) {
            results.add(fromUrl(url));
        }
        return Collections.unmodifiableList(results);
    }

    public LoaderConfig config() {
        return config;
    }

    private boolean isPattern(String value) {
        return value.contains(config.wildcard());
    }

    private static Instant toInstant(String name, Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof String) {
            try {
                return Instant.parse((String) value);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(name + " is not an ISO-8601 instant: " + value, e);
            }
        }
        throw new IllegalArgumentException(name + " must be an Instant or ISO-8601 string (current: " + value + ")");
    }
}
