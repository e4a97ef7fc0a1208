package com.authority.api.security;

import com.authority.api.exception.InvalidArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Alias 单元测试")
class AliasTest {

    @Test
    @DisplayName("includes 只判断直接包含")
    void includesShouldTestDirectMembership() {
        Alias manage = Alias.of("manage", "create", "read", "update", "delete");

        assertTrue(manage.includes("read"));
        assertFalse(manage.includes("manage"));
        assertFalse(manage.includes("comment"));
    }

    @Test
    @DisplayName("动作保持声明顺序并去重")
    void actionsShouldKeepOrderAndDeduplicate() {
        Alias alias = Alias.of("edit", List.of("update", "create", "update"));

        assertEquals(List.of("update", "create"), List.copyOf(alias.actions()));
    }

    @Test
    @DisplayName("动作集合是防御性拷贝且不可修改")
    void actionsShouldBeImmutableCopy() {
        List<String> source = new ArrayList<>(List.of("read"));
        Alias alias = Alias.of("view", source);
        source.add("delete");

        assertFalse(alias.includes("delete"));
        assertThrows(UnsupportedOperationException.class, () -> alias.actions().add("delete"));
    }

    @Test
    @DisplayName("非法参数被拒绝")
    void shouldRejectInvalidArguments() {
        assertThrows(InvalidArgumentException.class, () -> Alias.of("", "read"));
        assertThrows(InvalidArgumentException.class, () -> Alias.of("manage", (List<String>) null));
    }

    @Test
    @DisplayName("空动作列表是合法别名")
    void emptyAliasShouldBeAllowed() {
        Alias alias = Alias.of("nothing", List.of());

        assertTrue(alias.actions().isEmpty());
        assertEquals("nothing=[]", alias.toString());
    }
}
