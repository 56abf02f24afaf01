package com.runframe.core.runner;

import com.runframe.api.config.Config;
import com.runframe.api.exception.RunFrameException;
import com.runframe.api.provider.ProviderFactory;
import com.runframe.api.provider.ProviderKind;
import com.runframe.core.config.ConfigLoader;
import com.runframe.core.docker.DockerServersService;
import com.runframe.core.exception.ConfigurationException;
import com.runframe.core.lifecycle.Lifecycle;
import com.runframe.core.lifecycle.LifecyclePhase;
import com.runframe.core.metadata.TestMetadata;
import com.runframe.core.provider.NeverCompletingFuture;
import com.runframe.core.provider.ProviderCollection;
import com.runframe.core.provider.ProviderSpec;
import com.runframe.core.provider.ProviderSpecReader;
import com.runframe.core.runtime.SequentialTestRuntime;
import com.runframe.core.spi.DatastoreClientFactory;
import com.runframe.core.spi.TestRunOptions;
import com.runframe.core.spi.TestRuntime;
import com.runframe.core.suite.LoadedSuite;
import com.runframe.core.suite.SuiteLoader;
import com.runframe.core.version.DatastoreVersion;
import com.runframe.core.version.DatastoreVersionValidator;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 功能测试运行器
 * <p>
 * 一次运行的编排者：加载配置 → 构建提供者 → （可选）校验数据存储版本 → 加载套件 → 交给测试运行时执行。
 * 无论成功与否，最终都会关闭并触发 cleanup 阶段。
 * <p>
 * 每个实例只对应一次运行，不可复用。
 */
public class FunctionalTestRunner implements AutoCloseable {

    /**
     * 触发数据存储版本校验的 Service 名称
     */
    public static final String DATASTORE_SERVICE = "es";

    private final Logger log;
    private final Path configFile;
    private final Map<String, Object> configOverrides;
    private final DatastoreVersion datastoreVersion;
    private final TestRuntime testRuntime;
    private final DatastoreClientFactory datastoreClientFactory;

    private final Lifecycle lifecycle = new Lifecycle();
    private final TestMetadata testMetadata = new TestMetadata(lifecycle);
    private final SuiteLoader suiteLoader = new SuiteLoader();

    private final AtomicBoolean closed = new AtomicBoolean(false);

    public FunctionalTestRunner(Logger log, Path configFile, Map<String, Object> configOverrides, Object version) {
        this(log, configFile, configOverrides, version, new SequentialTestRuntime(), null);
    }

    /**
     * @param version                预期数据存储版本（字符串或 {@link DatastoreVersion}），为 null 时取默认值
     * @param datastoreClientFactory 版本校验用客户端工厂，可为 null（跳过校验）
     */
    public FunctionalTestRunner(Logger log,
                                Path configFile,
                                Map<String, Object> configOverrides,
                                Object version,
                                TestRuntime testRuntime,
                                DatastoreClientFactory datastoreClientFactory) {
        this.log = log;
        this.configFile = configFile;
        this.configOverrides = configOverrides != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(configOverrides))
                : Collections.emptyMap();
        this.datastoreVersion = DatastoreVersion.of(version);
        this.testRuntime = testRuntime;
        this.datastoreClientFactory = datastoreClientFactory;

        for (LifecyclePhase<?> phase : lifecycle.phases().values()) {
            phase.onStart(() -> log.debug("starting [{}] lifecycle phase", phase.getName()));
            phase.onComplete(() -> log.debug("completed [{}] lifecycle phase", phase.getName()));
        }
    }

    public Lifecycle getLifecycle() {
        return lifecycle;
    }

    public TestMetadata getTestMetadata() {
        return testMetadata;
    }

    public DatastoreVersion getDatastoreVersion() {
        return datastoreVersion;
    }

    public boolean isClosed() {
        return closed.get();
    }

    // ==================== 运行 ====================

    /**
     * 执行测试
     *
     * @return 失败数（自定义运行器时为其返回值）
     */
    public int run() {
        return execute((config, coreProviders) -> {
            List<ProviderSpec> specs = new ArrayList<>(coreProviders);
            specs.addAll(ProviderSpecReader.read(ProviderKind.SERVICE, config.get("services")));
            specs.addAll(ProviderSpecReader.read(ProviderKind.PAGE_OBJECT, config.get("pageObjects")));
            ProviderCollection providers = new ProviderCollection(specs);

            if (providers.hasService(DATASTORE_SERVICE)) {
                validateDatastoreVersion(config);
            }
            providers.loadAll();

            Object customTestRunner = config.get("testRunner");
            if (customTestRunner != null) {
                log.warn("custom test runner defined, ignoring all suite/filtering related options");
                ProviderFactory runnerFn = ProviderSpecReader.toFactory("testRunner", customTestRunner);
                return toFailureCount(providers.invokeProviderFn(runnerFn));
            }

            LoadedSuite loaded = suiteLoader.load(config, providers);
            TestRunOptions options = TestRunOptions.from(config);
            if (options.isDryRun()) {
                log.info("Dry run results will be stored in {}", options.getDryRunOutput());
            }

            lifecycle.getBeforeTests().trigger(loaded.getRoot());
            log.info("Starting tests");
            return testRuntime.run(loaded.getRoot(), lifecycle, options);
        });
    }

    /**
     * 只加载套件、不执行测试，统计测试数量
     * <p>
     * 除 {@code servicesRequiredForTestAnalysis} 中列出的 Service 外，
     * 所有配置的提供者都被替换为永不完成的占位，测试文件只能拿到未解析的引用。
     */
    public TestStats getTestStats() {
        return execute((config, coreProviders) -> {
            if (config.get("testRunner") != null) {
                throw new RunFrameException("Unable to get test stats for config that uses a custom test runner");
            }

            Set<String> required = new HashSet<>();
            for (Object name : config.getList("servicesRequiredForTestAnalysis")) {
                required.add(String.valueOf(name));
            }

            List<ProviderSpec> specs = new ArrayList<>(coreProviders);
            specs.addAll(stub(ProviderSpecReader.read(ProviderKind.SERVICE, config.get("services")), required));
            specs.addAll(stub(ProviderSpecReader.read(ProviderKind.PAGE_OBJECT, config.get("pageObjects")),
                    Collections.emptySet()));
            ProviderCollection providers = new ProviderCollection(specs);

            LoadedSuite loaded = suiteLoader.load(config, providers);
            return new TestStats(loaded.getRoot().countTests(), loaded.getTestsExcludedByTag());
        });
    }

    /**
     * 关闭运行器，触发 cleanup 阶段；重复调用无效果
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        lifecycle.getCleanup().trigger();
    }

    // ==================== 内部 ====================

    @FunctionalInterface
    private interface RunHandler<T> {
        T handle(Config config, List<ProviderSpec> coreProviders);
    }

    private <T> T execute(RunHandler<T> handler) {
        RunOutcome<T> outcome;
        try {
            Config config = ConfigLoader.readConfigFile(configFile, configOverrides);
            log.info("Config loaded");

            if (config.getList("testFiles").isEmpty() && config.get("testRunner") == null) {
                throw new ConfigurationException("testFiles", "No tests defined.");
            }

            outcome = RunOutcome.success(handler.handle(config, coreProviders(config)));
        } catch (RuntimeException | Error e) {
            outcome = RunOutcome.failure(e);
        }

        try {
            close();
        } catch (RuntimeException | Error e) {
            outcome = outcome.withTeardownError(e);
        }
        return outcome.unwrap(log);
    }

    /**
     * 运行器自身暴露的基础 Service
     */
    private List<ProviderSpec> coreProviders(Config config) {
        DockerServersService dockerServers = new DockerServersService(config.get("dockerServers", Map.class));

        List<ProviderSpec> specs = new ArrayList<>();
        specs.add(ProviderSpec.service("lifecycle", context -> lifecycle));
        specs.add(ProviderSpec.service("log", context -> log));
        specs.add(ProviderSpec.service("testMetadata", context -> testMetadata));
        specs.add(ProviderSpec.service("config", context -> config));
        specs.add(ProviderSpec.service("dockerServers", context -> dockerServers));
        specs.add(ProviderSpec.service("esVersion", context -> datastoreVersion));
        return specs;
    }

    private List<ProviderSpec> stub(List<ProviderSpec> specs, Set<String> required) {
        List<ProviderSpec> result = new ArrayList<>(specs.size());
        for (ProviderSpec spec : specs) {
            if (required.contains(spec.getName())) {
                result.add(spec.withFactory(rejectAsync(spec)));
            } else {
                result.add(spec.withFactory(context -> NeverCompletingFuture.create()));
            }
        }
        return result;
    }

    private static ProviderFactory rejectAsync(ProviderSpec spec) {
        ProviderFactory factory = spec.getFactory();
        return context -> {
            Object result = factory.create(context);
            if (result instanceof CompletionStage) {
                throw new RunFrameException("Provider [" + spec.getName()
                        + "] returns an asynchronous result so it can't be loaded during test analysis");
            }
            return result;
        };
    }

    private void validateDatastoreVersion(Config config) {
        if (datastoreClientFactory == null) {
            log.warn("Service [{}] is registered but no datastore client factory is available, skipping version check",
                    DATASTORE_SERVICE);
            return;
        }
        new DatastoreVersionValidator(datastoreClientFactory, datastoreVersion).validate(config);
    }

    private static int toFailureCount(Object result) {
        if (result == null) {
            return 0;
        }
        if (result instanceof Number) {
            return ((Number) result).intValue();
        }
        throw new RunFrameException("custom test runner must return a failure count, got "
                + result.getClass().getSimpleName());
    }
}
