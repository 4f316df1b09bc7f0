package com.work.proof.core.support;

import org.web3j.crypto.WalletUtils;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Locale;

/**
 * 参数校验工具类，统一参数校验逻辑，减少代码重复
 */
public final class ValidationUtils {

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验Duration必须大于0
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    /**
     * 校验long值必须非负
     */
    public static long requireNonNegative(long value, String paramName) {
        if (value < 0) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return value;
    }

    /**
     * 校验金额非null且非负（token 数量按 uint256 语义处理）
     */
    public static BigInteger requireNonNegative(BigInteger value, String paramName) {
        requireNonNull(value, paramName);
        if (value.signum() < 0) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return value;
    }

    /**
     * 校验 EVM 地址格式（0x + 40 位十六进制），返回小写规范形式。
     * <p>零地址在格式上合法，是否允许由调用方决定，见 {@link #isZeroAddress(String)}。</p>
     */
    public static String requireAddress(String address, String paramName) {
        requireNonEmpty(address, paramName);
        String trimmed = address.trim();
        if (!trimmed.startsWith("0x") || !WalletUtils.isValidAddress(trimmed)) {
            throw new IllegalArgumentException(paramName + " 不是合法的地址: " + address);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    public static boolean isZeroAddress(String address) {
        return address == null || Numeric.toBigInt(address).signum() == 0;
    }
}
