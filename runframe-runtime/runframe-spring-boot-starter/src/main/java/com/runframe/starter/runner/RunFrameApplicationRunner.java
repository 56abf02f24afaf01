package com.runframe.starter.runner;

import com.runframe.api.exception.RunFrameException;
import com.runframe.core.runner.FunctionalTestRunner;
import com.runframe.core.runner.TestStats;
import com.runframe.starter.config.RunFrameProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 应用启动后自动执行功能测试
 */
@Slf4j
@RequiredArgsConstructor
public class RunFrameApplicationRunner implements ApplicationRunner {

    private final FunctionalTestRunnerFactory runnerFactory;
    private final RunFrameProperties properties;

    private final AtomicBoolean executed = new AtomicBoolean(false);

    @Override
    public void run(ApplicationArguments args) {
        if (!executed.compareAndSet(false, true)) {
            return;
        }

        FunctionalTestRunner runner = runnerFactory.create();
        if (properties.getMode() == RunFrameProperties.Mode.STATS) {
            TestStats stats = runner.getTestStats();
            log.info("Functional tests: {} tests, {} excluded by tag",
                    stats.getTestCount(), stats.getTestsExcludedByTag().size());
            return;
        }

        int failures = runner.run();
        if (failures > 0) {
            if (properties.isFailOnTestFailure()) {
                throw new RunFrameException(failures + " functional test failures");
            }
            log.warn("Functional tests finished with {} failures", failures);
        } else {
            log.info("Functional tests finished without failures");
        }
    }
}
