package com.runframe.core.spi;

import com.runframe.api.config.Config;

/**
 * 数据存储客户端工厂 SPI
 */
@FunctionalInterface
public interface DatastoreClientFactory {

    /**
     * 根据运行配置创建客户端
     */
    DatastoreClient create(Config config) throws Exception;
}
