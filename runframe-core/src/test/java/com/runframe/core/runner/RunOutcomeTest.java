package com.runframe.core.runner;

import com.runframe.api.exception.RunFrameException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("RunOutcome 单元测试")
public class RunOutcomeTest {

    private final Logger log = mock(Logger.class);

    @Test
    @DisplayName("成功时返回值")
    void successShouldReturnValue() {
        RunOutcome<Integer> outcome = RunOutcome.success(3);

        assertTrue(outcome.isSuccess());
        assertEquals(3, outcome.unwrap(log));
    }

    @Test
    @DisplayName("主错误优先，收尾错误写日志")
    void primaryErrorShouldWin() {
        IllegalStateException primary = new IllegalStateException("run");
        IllegalStateException teardown = new IllegalStateException("close");

        RunOutcome<Integer> outcome = RunOutcome.<Integer>failure(primary).withTeardownError(teardown);

        assertSame(primary, assertThrows(IllegalStateException.class, () -> outcome.unwrap(log)));
        verify(log).error("failed to close functional test runner", teardown);
    }

    @Test
    @DisplayName("只有收尾错误时抛出收尾错误")
    void teardownErrorShouldSurfaceAlone() {
        IllegalStateException teardown = new IllegalStateException("close");

        RunOutcome<Integer> outcome = RunOutcome.success(1).withTeardownError(teardown);

        assertSame(teardown, assertThrows(IllegalStateException.class, () -> outcome.unwrap(log)));
        verifyNoInteractions(log);
    }

    @Test
    @DisplayName("受检异常包装为 RunFrameException")
    void checkedErrorShouldBeWrapped() {
        IOException primary = new IOException("io");

        RunFrameException ex = assertThrows(RunFrameException.class,
                () -> RunOutcome.failure(primary).unwrap(log));

        assertSame(primary, ex.getCause());
    }
}
