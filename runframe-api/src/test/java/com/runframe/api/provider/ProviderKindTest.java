package com.runframe.api.provider;

import com.runframe.api.exception.InvalidArgumentException;
import com.runframe.api.exception.RunFrameException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProviderKind 单元测试")
public class ProviderKindTest {

    @Test
    @DisplayName("展示名用于错误信息与缓存键")
    void displayNameShouldBeUsedAsString() {
        assertEquals("Service", ProviderKind.SERVICE.toString());
        assertEquals("PageObject", ProviderKind.PAGE_OBJECT.getDisplayName());
    }

    @Test
    @DisplayName("参数异常携带参数名与非法值")
    void invalidArgumentShouldCarryContext() {
        InvalidArgumentException ex = new InvalidArgumentException("name", 42, "bad name");

        assertInstanceOf(RunFrameException.class, ex);
        assertEquals("name", ex.getParamName());
        assertEquals(42, ex.getInvalidValue());
        assertEquals("bad name", ex.getMessage());
    }
}
