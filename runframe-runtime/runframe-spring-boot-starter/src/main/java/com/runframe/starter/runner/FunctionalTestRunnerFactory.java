package com.runframe.starter.runner;

import com.runframe.core.runner.FunctionalTestRunner;
import com.runframe.core.spi.DatastoreClientFactory;
import com.runframe.core.spi.TestRuntime;
import com.runframe.starter.config.RunFrameProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按 {@code runframe.*} 属性创建运行器
 * <p>
 * 运行器一次性使用，每次运行都需要新建。
 */
@RequiredArgsConstructor
public class FunctionalTestRunnerFactory {

    private static final Logger RUNNER_LOG = LoggerFactory.getLogger(FunctionalTestRunner.class);

    private final RunFrameProperties properties;
    private final TestRuntime testRuntime;
    private final DatastoreClientFactory datastoreClientFactory;

    public FunctionalTestRunner create() {
        return create(Map.of());
    }

    /**
     * @param extraOverrides 额外覆盖项，优先级高于属性中的 overrides
     */
    public FunctionalTestRunner create(Map<String, Object> extraOverrides) {
        return new FunctionalTestRunner(RUNNER_LOG, resolveConfigFile(), buildOverrides(extraOverrides),
                properties.getDatastoreVersion(), testRuntime, datastoreClientFactory);
    }

    Map<String, Object> buildOverrides(Map<String, Object> extraOverrides) {
        Map<String, Object> overrides = new LinkedHashMap<>(properties.getOverrides());
        List<String> testFiles = properties.getTestFiles();
        if (testFiles != null && !testFiles.isEmpty()) {
            overrides.put("testFiles", testFiles);
        }
        overrides.putAll(extraOverrides);
        return overrides;
    }

    private Path resolveConfigFile() {
        String configFile = properties.getConfigFile();
        if (configFile == null || configFile.isBlank()) {
            return null;
        }
        return Paths.get(configFile).toAbsolutePath();
    }
}
