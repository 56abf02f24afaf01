package com.runframe.core.version;

import com.runframe.api.config.Config;
import com.runframe.core.exception.VersionCheckException;
import com.runframe.core.exception.VersionMismatchException;
import com.runframe.core.spi.DatastoreClient;
import com.runframe.core.spi.DatastoreClientFactory;
import com.runframe.core.spi.DatastoreInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("DatastoreVersionValidator 单元测试")
public class DatastoreVersionValidatorTest {

    @Mock
    private DatastoreClientFactory clientFactory;

    @Mock
    private DatastoreClient client;

    @Mock
    private Config config;

    private DatastoreVersionValidator validator;

    @BeforeEach
    void setUp() throws Exception {
        when(clientFactory.create(config)).thenReturn(client);
        validator = new DatastoreVersionValidator(clientFactory, DatastoreVersion.parse("8.1.0"));
    }

    @Test
    @DisplayName("版本相符时通过并关闭客户端")
    void matchingVersionShouldPass() throws Exception {
        when(client.info()).thenReturn(DatastoreInfo.ofVersion("8.1.0"));

        assertDoesNotThrow(() -> validator.validate(config));

        verify(client).close();
    }

    @Test
    @DisplayName("版本不符时报告双方版本")
    void mismatchShouldNameBothVersions() throws Exception {
        when(client.info()).thenReturn(DatastoreInfo.ofVersion("8.2.0"));

        VersionMismatchException ex = assertThrows(VersionMismatchException.class, () -> validator.validate(config));

        assertEquals("8.1.0", ex.getExpectedVersion());
        assertEquals("8.2.0", ex.getReportedVersion());
        assertEquals("Datastore reports a version number \"8.2.0\" which doesn't match supplied version \"8.1.0\"",
                ex.getMessage());
        verify(client).close();
    }

    @Test
    @DisplayName("请求失败时包装原因且仍关闭客户端")
    void requestFailureShouldWrapCause() throws Exception {
        IOException cause = new IOException("connection refused");
        when(client.info()).thenThrow(cause);

        VersionCheckException ex = assertThrows(VersionCheckException.class, () -> validator.validate(config));

        assertSame(cause, ex.getCause());
        assertTrue(ex.getMessage().contains("connection refused"));
        verify(client).close();
    }

    @Test
    @DisplayName("关闭失败不影响校验结果")
    void closeFailureShouldBeIgnored() throws Exception {
        when(client.info()).thenReturn(DatastoreInfo.ofVersion("8.1.0"));
        doThrow(new IOException("already closed")).when(client).close();

        assertDoesNotThrow(() -> validator.validate(config));
    }

    @Test
    @DisplayName("客户端创建失败应报告版本检查错误")
    void clientCreationFailureShouldFail() throws Exception {
        when(clientFactory.create(config)).thenThrow(new IllegalStateException("no hosts"));

        assertThrows(VersionCheckException.class, () -> validator.validate(config));
        verify(client, never()).info();
    }
}
