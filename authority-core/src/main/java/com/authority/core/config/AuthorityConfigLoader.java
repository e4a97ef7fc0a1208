package com.authority.core.config;

import com.authority.api.exception.InvalidArgumentException;
import com.authority.core.cache.CacheMode;
import com.authority.core.resolver.TypeNaming;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * 从 authority.yml 加载引擎配置
 * <pre>
 * authority:
 *   cache-mode: INVALIDATE_ON_ADD
 *   cache-maximum-size: 10000
 *   type-naming: SIMPLE_NAME
 * </pre>
 * 缺省的键取 {@link AuthorityConfig#defaults()} 的值。
 */
@Slf4j
public class AuthorityConfigLoader {

    public static final String DEFAULT_RESOURCE = "authority.yml";

    private static final String ROOT_KEY = "authority";
    private static final String CACHE_MODE = "cache-mode";
    private static final String CACHE_MAXIMUM_SIZE = "cache-maximum-size";
    private static final String TYPE_NAMING = "type-naming";

    private AuthorityConfigLoader() {
    }

    /**
     * 从类路径加载 authority.yml，不存在时返回默认配置
     */
    public static AuthorityConfig load() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static AuthorityConfig loadResource(String resourceName) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = AuthorityConfigLoader.class.getClassLoader();
        }
        InputStream is = cl.getResourceAsStream(resourceName);
        if (is == null) {
            log.debug("[Config] {} not found on classpath, using defaults", resourceName);
            return AuthorityConfig.defaults();
        }
        return load(is);
    }

    public static AuthorityConfig load(Path file) {
        if (!Files.isRegularFile(file)) {
            log.debug("[Config] {} does not exist, using defaults", file);
            return AuthorityConfig.defaults();
        }
        try {
            return load(Files.newInputStream(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    public static AuthorityConfig load(InputStream inputStream) {
        Object document;
        try (InputStream is = inputStream) {
            document = createYaml().load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load YAML configuration", e);
        }

        AuthorityConfig config = fromDocument(document);
        log.info("[Config] Loaded {}", config);
        return config;
    }

    private static AuthorityConfig fromDocument(Object document) {
        if (document == null) {
            return AuthorityConfig.defaults();
        }
        Map<?, ?> section = asMap(ROOT_KEY, asMap("<root>", document).get(ROOT_KEY));
        if (section == null) {
            return AuthorityConfig.defaults();
        }

        AuthorityConfig.AuthorityConfigBuilder builder = AuthorityConfig.builder();
        Object cacheMode = section.get(CACHE_MODE);
        if (cacheMode != null) {
            builder.cacheMode(parseEnum(CACHE_MODE, cacheMode, CacheMode.class));
        }
        Object maximumSize = section.get(CACHE_MAXIMUM_SIZE);
        if (maximumSize != null) {
            builder.cacheMaximumSize(parsePositiveLong(CACHE_MAXIMUM_SIZE, maximumSize));
        }
        Object typeNaming = section.get(TYPE_NAMING);
        if (typeNaming != null) {
            builder.typeNaming(parseEnum(TYPE_NAMING, typeNaming, TypeNaming.class));
        }
        return builder.build();
    }

    private static Map<?, ?> asMap(String key, Object node) {
        if (node == null || node instanceof Map) {
            return (Map<?, ?>) node;
        }
        throw new InvalidArgumentException(key, node, "Expected a mapping for [" + key + "]");
    }

    private static <E extends Enum<E>> E parseEnum(String key, Object raw, Class<E> type) {
        String name = raw.toString().trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException(key, raw, "Unknown value for [" + key + "]: " + raw);
        }
    }

    private static long parsePositiveLong(String key, Object raw) {
        long value;
        if (raw instanceof Integer || raw instanceof Long) {
            value = ((Number) raw).longValue();
        } else if (raw instanceof BigInteger) {
            try {
                value = ((BigInteger) raw).longValueExact();
            } catch (ArithmeticException e) {
                throw new InvalidArgumentException(key, raw, "Out of range for [" + key + "]: " + raw);
            }
        } else if (raw instanceof Number) {
            throw new InvalidArgumentException(key, raw, "Not an integer for [" + key + "]: " + raw);
        } else {
            try {
                value = Long.parseLong(raw.toString().trim().replace("_", ""));
            } catch (NumberFormatException e) {
                throw new InvalidArgumentException(key, raw, "Not a number for [" + key + "]: " + raw);
            }
        }
        if (value <= 0) {
            throw new InvalidArgumentException(key, raw, "[" + key + "] must be positive: " + raw);
        }
        return value;
    }

    /**
     * 配置只包含普通映射，拒绝所有 !! 全局标签
     */
    private static Yaml createYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setTagInspector(tag -> false);
        return new Yaml(new SafeConstructor(loaderOptions));
    }
}
