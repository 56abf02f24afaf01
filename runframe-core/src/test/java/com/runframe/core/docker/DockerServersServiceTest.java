package com.runframe.core.docker;

import com.runframe.api.exception.InvalidArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DockerServersService 单元测试")
public class DockerServersServiceTest {

    private final DockerServersService service = new DockerServersService(Map.of(
            "registry", Map.of("enabled", true, "port", 5000),
            "fleet", Map.of("enabled", false)));

    @Test
    @DisplayName("透传各服务器配置")
    void shouldExposeServerConfig() {
        assertEquals(Set.of("registry", "fleet"), service.getNames());
        assertTrue(service.has("registry"));
        assertEquals(5000, service.getConfig("registry").get("port"));
    }

    @Test
    @DisplayName("只有 enabled: true 的服务器视为启用")
    void enabledFlagShouldBeRespected() {
        assertTrue(service.isEnabled("registry"));
        assertFalse(service.isEnabled("fleet"));
        assertFalse(service.isEnabled("missing"));
    }

    @Test
    @DisplayName("未知服务器与非法配置应报参数错误")
    void invalidAccessShouldFail() {
        assertThrows(InvalidArgumentException.class, () -> service.getConfig("missing"));
        assertThrows(InvalidArgumentException.class, () -> new DockerServersService(Map.of("bad", "value")));
        assertTrue(new DockerServersService(null).getNames().isEmpty());
    }
}
