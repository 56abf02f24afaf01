package com.runframe.core.docker;

import com.runframe.api.exception.InvalidArgumentException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Docker 服务器配置视图
 * <p>
 * 只读透传 {@code dockerServers} 配置块，本框架不启动或管理任何容器。
 */
public class DockerServersService {

    private final Map<String, Map<String, Object>> servers;

    public DockerServersService(Map<?, ?> config) {
        Map<String, Map<String, Object>> parsed = new LinkedHashMap<>();
        if (config != null) {
            for (Map.Entry<?, ?> entry : config.entrySet()) {
                String name = String.valueOf(entry.getKey());
                if (!(entry.getValue() instanceof Map)) {
                    throw new InvalidArgumentException("dockerServers." + name, entry.getValue(),
                            "Docker server [" + name + "] must be configured with a mapping");
                }
                Map<String, Object> serverConfig = new LinkedHashMap<>();
                ((Map<?, ?>) entry.getValue()).forEach((k, v) -> serverConfig.put(String.valueOf(k), v));
                parsed.put(name, Collections.unmodifiableMap(serverConfig));
            }
        }
        this.servers = Collections.unmodifiableMap(parsed);
    }

    public Set<String> getNames() {
        return servers.keySet();
    }

    public boolean has(String name) {
        return servers.containsKey(name);
    }

    /**
     * 服务器是否被标记为启用（{@code enabled: true}）
     */
    public boolean isEnabled(String name) {
        return has(name) && Boolean.TRUE.equals(servers.get(name).get("enabled"));
    }

    public Map<String, Object> getConfig(String name) {
        Map<String, Object> serverConfig = servers.get(name);
        if (serverConfig == null) {
            throw new InvalidArgumentException("name", name, "Unknown docker server [" + name + "]");
        }
        return serverConfig;
    }
}
