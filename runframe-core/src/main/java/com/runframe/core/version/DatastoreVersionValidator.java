package com.runframe.core.version;

import com.runframe.api.config.Config;
import com.runframe.core.exception.VersionCheckException;
import com.runframe.core.exception.VersionMismatchException;
import com.runframe.core.spi.DatastoreClient;
import com.runframe.core.spi.DatastoreClientFactory;
import com.runframe.core.spi.DatastoreInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 数据存储版本校验
 * <p>
 * 连接只用于本次校验：无论获取成功、失败，连接都会被关闭；
 * 关闭失败只记录日志，不会掩盖之前的错误。
 */
@Slf4j
@RequiredArgsConstructor
public class DatastoreVersionValidator {

    private final DatastoreClientFactory clientFactory;
    private final DatastoreVersion expectedVersion;

    /**
     * @throws VersionCheckException    获取版本信息失败
     * @throws VersionMismatchException 版本不符
     */
    public void validate(Config config) {
        DatastoreClient client;
        try {
            client = clientFactory.create(config);
        } catch (Exception e) {
            throw new VersionCheckException(
                    "attempted to create a datastore client to fetch version info but it failed: " + e.getMessage(), e);
        }

        DatastoreInfo info;
        try {
            info = client.info();
        } catch (Exception e) {
            throw new VersionCheckException(
                    "attempted to use the \"es\" service to fetch datastore version info but the request failed: "
                            + e.getMessage(), e);
        } finally {
            closeQuietly(client);
        }

        String reported = info != null ? info.getVersionNumber() : null;
        if (!expectedVersion.eql(reported)) {
            throw new VersionMismatchException(expectedVersion.toString(), reported);
        }
        log.info("Datastore version {} matches expected version {}", reported, expectedVersion);
    }

    private void closeQuietly(DatastoreClient client) {
        try {
            client.close();
        } catch (Exception e) {
            log.debug("Failed to close datastore client after version check", e);
        }
    }
}
