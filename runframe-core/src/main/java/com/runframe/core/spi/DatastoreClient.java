package com.runframe.core.spi;

/**
 * 数据存储客户端 SPI
 * <p>
 * 只用于启动前的版本校验，每次校验创建并关闭一个新连接。
 */
public interface DatastoreClient extends AutoCloseable {

    /**
     * 请求版本元信息
     */
    DatastoreInfo info() throws Exception;

    @Override
    void close() throws Exception;
}
