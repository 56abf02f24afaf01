package com.runframe.core.spi;

import lombok.Value;

/**
 * 数据存储元信息
 */
@Value
public class DatastoreInfo {
    String versionNumber;
    String clusterName;

    public static DatastoreInfo ofVersion(String versionNumber) {
        return new DatastoreInfo(versionNumber, null);
    }
}
