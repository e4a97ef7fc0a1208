package com.authority.core.resolver;

import com.authority.api.exception.UnresolvableResourceException;
import com.authority.core.fixture.Document;
import com.authority.core.fixture.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefaultResourceTypeResolver 单元测试")
class DefaultResourceTypeResolverTest {

    @Nested
    @DisplayName("类名推导")
    class ClassNameTests {

        @Test
        @DisplayName("默认使用简单类名")
        void shouldUseSimpleNameByDefault() {
            DefaultResourceTypeResolver resolver = new DefaultResourceTypeResolver();

            assertEquals(TypeNaming.SIMPLE_NAME, resolver.getTypeNaming());
            assertEquals("User", resolver.resolve(new User(1, "a")));
            assertEquals("User", resolver.nameOf(User.class));
            assertEquals("String", resolver.resolve("plain"));
        }

        @Test
        @DisplayName("可配置为全限定类名")
        void shouldUseQualifiedNameWhenConfigured() {
            DefaultResourceTypeResolver resolver = new DefaultResourceTypeResolver(TypeNaming.QUALIFIED_NAME);

            assertEquals("com.authority.core.fixture.User", resolver.resolve(new User(1, "a")));
        }

        @Test
        @DisplayName("null 命名方式退回简单类名")
        void nullNamingShouldFallBack() {
            assertEquals(TypeNaming.SIMPLE_NAME, new DefaultResourceTypeResolver(null).getTypeNaming());
        }
    }

    @Nested
    @DisplayName("自报类型")
    class SelfDescribedTests {

        @Test
        @DisplayName("Resource 实现使用自报的类型名")
        void shouldUseDeclaredType() {
            assertEquals("Invoice", new DefaultResourceTypeResolver().resolve(new Document(1, "Invoice")));
        }

        @Test
        @DisplayName("自报空白类型名无法解析")
        void blankDeclaredTypeShouldFail() {
            UnresolvableResourceException ex = assertThrows(UnresolvableResourceException.class,
                    () -> new DefaultResourceTypeResolver().resolve(new Document(1, " ")));
            assertEquals(Document.class, ex.getValueType());
        }
    }

    @Nested
    @DisplayName("无法解析")
    class UnresolvableTests {

        @Test
        @DisplayName("null 值无法解析")
        void nullShouldFail() {
            UnresolvableResourceException ex = assertThrows(UnresolvableResourceException.class,
                    () -> new DefaultResourceTypeResolver().resolve(null));
            assertNull(ex.getValueType());
        }

        @Test
        @DisplayName("匿名类无法解析")
        void anonymousClassShouldFail() {
            Object anonymous = new Object() {
            };

            assertThrows(UnresolvableResourceException.class,
                    () -> new DefaultResourceTypeResolver().resolve(anonymous));
        }

        @Test
        @DisplayName("Lambda 无法解析")
        void lambdaShouldFail() {
            Supplier<String> lambda = () -> "x";

            assertThrows(UnresolvableResourceException.class,
                    () -> new DefaultResourceTypeResolver().resolve(lambda));
        }
    }
}
