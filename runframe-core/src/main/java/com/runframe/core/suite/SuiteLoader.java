package com.runframe.core.suite;

import com.runframe.api.config.Config;
import com.runframe.core.provider.ProviderCollection;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 套件加载器
 * <p>
 * 依次加载 {@code testFiles} 中声明的测试文件构建套件树，再按配置过滤。
 * 只定义结构，不执行任何测试或钩子。
 */
@Slf4j
public class SuiteLoader {

    public LoadedSuite load(Config config, ProviderCollection providers) {
        Suite root = Suite.root();
        DefaultSuiteContext context = new DefaultSuiteContext(root, providers.getContext());

        for (Object testFile : config.getList("testFiles")) {
            context.loadTestFile(testFile);
        }
        log.info("Loaded {} tests from {} test files", root.countTests(), context.getFileCount());

        List<String> excludedByTag = SuiteFilter.from(config).apply(root);
        return new LoadedSuite(root, excludedByTag);
    }
}
