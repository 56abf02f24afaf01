package com.runframe.core.version;

import com.runframe.api.exception.InvalidArgumentException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 期望的数据存储版本
 * <p>
 * 支持 {@code major.minor.patch[-prerelease][+build]}，可带 {@code v} 前缀，构建元数据不参与比较。
 * <p>
 * {@link #eql(String)} 的宽松规则：主版本号三段相同，且预发布标识相同或任一方为 SNAPSHOT。
 * 即期望 {@code 8.1.0} 可匹配 {@code 8.1.0-SNAPSHOT}，但不匹配 {@code 8.1.0-rc1}。
 */
public final class DatastoreVersion {

    public static final String VERSION_PROPERTY = "runframe.datastore.version";
    public static final String VERSION_ENV = "RUNFRAME_DATASTORE_VERSION";
    public static final String FALLBACK_VERSION = "8.0.0";

    private static final String SNAPSHOT = "SNAPSHOT";
    private static final Pattern SEMVER = Pattern.compile(
            "^v?(\\d+)\\.(\\d+)\\.(\\d+)(?:-([0-9A-Za-z.-]+))?(?:\\+[0-9A-Za-z.-]+)?$");

    private final int major;
    private final int minor;
    private final int patch;
    private final String prerelease;

    private DatastoreVersion(int major, int minor, int patch, String prerelease) {
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.prerelease = prerelease;
    }

    /**
     * 解析版本字符串
     *
     * @throws InvalidArgumentException 不是合法的语义化版本
     */
    public static DatastoreVersion parse(String version) {
        if (version == null) {
            throw new InvalidArgumentException("version", null, "Expected a valid semver version, got [null]");
        }
        Matcher matcher = SEMVER.matcher(version.trim());
        if (!matcher.matches()) {
            throw new InvalidArgumentException("version", version,
                    "Expected a valid semver version, got [" + version + "]");
        }
        try {
            return new DatastoreVersion(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)),
                    matcher.group(4));
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("version", version,
                    "Version number out of range in [" + version + "]", e);
        }
    }

    /**
     * 接受字符串或已构造的实例；null 时返回默认版本
     */
    public static DatastoreVersion of(Object version) {
        if (version == null) {
            return getDefault();
        }
        if (version instanceof DatastoreVersion) {
            return (DatastoreVersion) version;
        }
        if (version instanceof String) {
            return parse((String) version);
        }
        throw new InvalidArgumentException("version", version,
                "Expected a version string or DatastoreVersion, got " + version.getClass().getSimpleName());
    }

    /**
     * 默认版本：系统属性 → 环境变量 → 内置回退值
     */
    public static DatastoreVersion getDefault() {
        String fromProperty = System.getProperty(VERSION_PROPERTY);
        if (fromProperty != null && !fromProperty.trim().isEmpty()) {
            return parse(fromProperty);
        }
        String fromEnv = System.getenv(VERSION_ENV);
        if (fromEnv != null && !fromEnv.trim().isEmpty()) {
            return parse(fromEnv);
        }
        return parse(FALLBACK_VERSION);
    }

    /**
     * 判断数据存储上报的版本是否与期望版本相符
     */
    public boolean eql(String reported) {
        DatastoreVersion other;
        try {
            other = parse(reported);
        } catch (InvalidArgumentException e) {
            return false;
        }
        if (compareMain(other) != 0) {
            return false;
        }
        if (Objects.equals(prerelease, other.prerelease)) {
            return true;
        }
        return isSnapshot() || other.isSnapshot();
    }

    public boolean isSnapshot() {
        return SNAPSHOT.equalsIgnoreCase(prerelease);
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getPatch() {
        return patch;
    }

    public String getPrerelease() {
        return prerelease;
    }

    private int compareMain(DatastoreVersion other) {
        int majorCompare = Integer.compare(major, other.major);
        if (majorCompare != 0) return majorCompare;

        int minorCompare = Integer.compare(minor, other.minor);
        if (minorCompare != 0) return minorCompare;

        return Integer.compare(patch, other.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch + (prerelease != null ? "-" + prerelease : "");
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        DatastoreVersion other = (DatastoreVersion) obj;
        return major == other.major && minor == other.minor && patch == other.patch
                && Objects.equals(prerelease, other.prerelease);
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch, prerelease);
    }
}
