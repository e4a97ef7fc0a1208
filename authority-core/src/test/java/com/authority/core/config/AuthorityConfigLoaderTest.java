package com.authority.core.config;

import com.authority.api.exception.InvalidArgumentException;
import com.authority.core.cache.CacheMode;
import com.authority.core.resolver.TypeNaming;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AuthorityConfigLoader 单元测试")
class AuthorityConfigLoaderTest {

    @TempDir
    Path tempDir;

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("应从类路径资源加载配置")
    void shouldLoadClasspathResource() {
        AuthorityConfig config = AuthorityConfigLoader.loadResource("config/authority-strict.yml");

        assertEquals(CacheMode.FREEZE_AFTER_LOOKUP, config.getCacheMode());
        assertEquals(500, config.getCacheMaximumSize());
        assertEquals(TypeNaming.QUALIFIED_NAME, config.getTypeNaming());
    }

    @Test
    @DisplayName("资源或文件不存在时返回默认配置")
    void missingSourceShouldYieldDefaults() {
        AuthorityConfig fromResource = AuthorityConfigLoader.loadResource("config/missing.yml");
        AuthorityConfig fromFile = AuthorityConfigLoader.load(tempDir.resolve("missing.yml"));

        assertEquals(CacheMode.INVALIDATE_ON_ADD, fromResource.getCacheMode());
        assertEquals(CacheMode.INVALIDATE_ON_ADD, fromFile.getCacheMode());
    }

    @Test
    @DisplayName("应从文件加载，缺省的键取默认值")
    void shouldLoadFileWithPartialKeys() throws IOException {
        Path file = tempDir.resolve("authority.yml");
        Files.writeString(file, "authority:\n  cache-mode: STALE\n");

        AuthorityConfig config = AuthorityConfigLoader.load(file);

        assertEquals(CacheMode.STALE, config.getCacheMode());
        assertEquals(10_000, config.getCacheMaximumSize());
        assertEquals(TypeNaming.SIMPLE_NAME, config.getTypeNaming());
    }

    @Test
    @DisplayName("空文档或缺少 authority 节时返回默认配置")
    void emptyDocumentShouldYieldDefaults() {
        assertEquals(CacheMode.INVALIDATE_ON_ADD, AuthorityConfigLoader.load(yaml("")).getCacheMode());
        assertEquals(CacheMode.INVALIDATE_ON_ADD,
                AuthorityConfigLoader.load(yaml("other:\n  key: value\n")).getCacheMode());
    }

    @Test
    @DisplayName("非法取值报告出错的键")
    void invalidValuesShouldNameTheKey() {
        InvalidArgumentException badMode = assertThrows(InvalidArgumentException.class,
                () -> AuthorityConfigLoader.load(yaml("authority:\n  cache-mode: sometimes\n")));
        assertEquals("cache-mode", badMode.getParamName());

        InvalidArgumentException badSize = assertThrows(InvalidArgumentException.class,
                () -> AuthorityConfigLoader.load(yaml("authority:\n  cache-maximum-size: -1\n")));
        assertEquals("cache-maximum-size", badSize.getParamName());

        InvalidArgumentException notNumber = assertThrows(InvalidArgumentException.class,
                () -> AuthorityConfigLoader.load(yaml("authority:\n  cache-maximum-size: lots\n")));
        assertEquals("cache-maximum-size", notNumber.getParamName());

        InvalidArgumentException notMapping = assertThrows(InvalidArgumentException.class,
                () -> AuthorityConfigLoader.load(yaml("authority: flat\n")));
        assertEquals("authority", notMapping.getParamName());
    }

    @Test
    @DisplayName("缓存大小必须是整数，小数或超出范围的值被拒绝")
    void fractionalSizeShouldBeRejected() {
        InvalidArgumentException fractional = assertThrows(InvalidArgumentException.class,
                () -> AuthorityConfigLoader.load(yaml("authority:\n  cache-maximum-size: 1.5\n")));
        assertEquals("cache-maximum-size", fractional.getParamName());

        InvalidArgumentException quoted = assertThrows(InvalidArgumentException.class,
                () -> AuthorityConfigLoader.load(yaml("authority:\n  cache-maximum-size: \"2.5\"\n")));
        assertEquals("cache-maximum-size", quoted.getParamName());

        InvalidArgumentException tooLarge = assertThrows(InvalidArgumentException.class,
                () -> AuthorityConfigLoader.load(yaml("authority:\n  cache-maximum-size: 99999999999999999999\n")));
        assertEquals("cache-maximum-size", tooLarge.getParamName());

        assertEquals(2048, AuthorityConfigLoader.load(yaml("authority:\n  cache-maximum-size: 2048\n"))
                .getCacheMaximumSize());
    }

    @Test
    @DisplayName("拒绝全局类型标签")
    void shouldRejectGlobalTags() {
        assertThrows(RuntimeException.class, () -> AuthorityConfigLoader.load(
                yaml("authority: !!java.util.Date {}\n")));
    }
}
