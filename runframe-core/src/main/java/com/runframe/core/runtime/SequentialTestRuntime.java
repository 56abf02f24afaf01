package com.runframe.core.runtime;

import com.runframe.core.lifecycle.Lifecycle;
import com.runframe.core.lifecycle.RunnableFailure;
import com.runframe.core.spi.TestRunOptions;
import com.runframe.core.spi.TestRuntime;
import com.runframe.core.suite.Hook;
import com.runframe.core.suite.HookType;
import com.runframe.core.suite.Suite;
import com.runframe.core.suite.Test;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 默认测试运行时：单线程按定义顺序执行
 * <p>
 * 每个套件：beforeTestSuite → before 钩子 → 测试 → 子套件 → after 钩子 → afterTestSuite。
 * 每个测试：beforeEachRunnable → beforeEachTest → 继承的 beforeEach 钩子（外层优先）
 * → 测试体 → 继承的 afterEach 钩子（内层优先）。
 * <p>
 * 测试体与钩子的失败计入失败数；生命周期阶段处理器的失败直接中止运行。
 */
@Slf4j
public class SequentialTestRuntime implements TestRuntime {

    private final DryRunReporter dryRunReporter;

    public SequentialTestRuntime() {
        this(new DryRunReporter());
    }

    public SequentialTestRuntime(DryRunReporter dryRunReporter) {
        this.dryRunReporter = dryRunReporter;
    }

    @Override
    public int run(Suite root, Lifecycle lifecycle, TestRunOptions options) {
        if (options.isDryRun()) {
            log.info("Dry run enabled, tests will not be executed");
            dryRunReporter.write(root, options.getDryRunOutput());
            return 0;
        }

        RunState state = new RunState(lifecycle, options.isBail());
        runSuite(root, state);

        log.info("{} passing, {} failing, {} skipped", state.passed, state.failed, state.skipped);
        return state.failed;
    }

    // ==================== 套件 ====================

    private void runSuite(Suite suite, RunState state) {
        if (state.bailed) {
            return;
        }
        boolean root = suite.isRoot();
        if (!root) {
            state.lifecycle.getBeforeTestSuite().trigger(suite);
        }

        boolean ready = true;
        for (Hook hook : suite.getHooks(HookType.BEFORE_ALL)) {
            if (!runHook(hook, state)) {
                ready = false;
                break;
            }
        }

        if (ready) {
            for (Test test : suite.getTests()) {
                if (state.bailed) {
                    break;
                }
                runTest(test, state);
            }
            for (Suite child : suite.getSuites()) {
                runSuite(child, state);
            }
        } else {
            int skipped = suite.countTests();
            state.skipped += skipped;
            log.warn("[{}] before all hook failed, skipping {} tests", suite.fullTitle(), skipped);
        }

        for (Hook hook : suite.getHooks(HookType.AFTER_ALL)) {
            runHook(hook, state);
        }

        if (!root) {
            state.lifecycle.getAfterTestSuite().trigger(suite);
        }
    }

    // ==================== 测试 ====================

    private void runTest(Test test, RunState state) {
        state.lifecycle.getBeforeEachRunnable().trigger(test);
        state.lifecycle.getBeforeEachTest().trigger(test);

        boolean ready = true;
        for (Hook hook : inheritedHooks(test.getParent(), HookType.BEFORE_EACH)) {
            if (!runHook(hook, state)) {
                ready = false;
                break;
            }
        }

        if (!ready) {
            state.skipped++;
        } else {
            try {
                test.getBody().run();
                state.passed++;
                log.debug("[{}] passed", test.fullTitle());
            } catch (Exception | AssertionError e) {
                state.failed++;
                log.warn("[{}] failed: {}", test.fullTitle(), e.getMessage());
                state.lifecycle.getTestFailure().trigger(new RunnableFailure(e, test));
                state.bailIfRequested();
            }
        }

        List<Hook> afterEach = inheritedHooks(test.getParent(), HookType.AFTER_EACH);
        Collections.reverse(afterEach);
        for (Hook hook : afterEach) {
            runHook(hook, state);
        }
    }

    private boolean runHook(Hook hook, RunState state) {
        state.lifecycle.getBeforeEachRunnable().trigger(hook);
        try {
            hook.getBody().run();
            return true;
        } catch (Exception | AssertionError e) {
            state.failed++;
            log.warn("[{}] failed: {}", hook.fullTitle(), e.getMessage());
            state.lifecycle.getTestHookFailure().trigger(new RunnableFailure(e, hook));
            state.bailIfRequested();
            return false;
        }
    }

    /**
     * 从根到当前套件收集某类钩子
     */
    private static List<Hook> inheritedHooks(Suite suite, HookType type) {
        List<Suite> chain = new ArrayList<>();
        for (Suite s = suite; s != null; s = s.getParent()) {
            chain.add(s);
        }
        Collections.reverse(chain);

        List<Hook> hooks = new ArrayList<>();
        for (Suite s : chain) {
            hooks.addAll(s.getHooks(type));
        }
        return hooks;
    }

    private static final class RunState {
        private final Lifecycle lifecycle;
        private final boolean bail;

        private int passed;
        private int failed;
        private int skipped;
        private boolean bailed;

        private RunState(Lifecycle lifecycle, boolean bail) {
            this.lifecycle = lifecycle;
            this.bail = bail;
        }

        private void bailIfRequested() {
            if (bail && !bailed) {
                bailed = true;
                log.info("Bail enabled, stopping after first failure");
            }
        }
    }
}
