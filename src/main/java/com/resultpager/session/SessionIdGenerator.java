package com.resultpager.session;

import java.security.SecureRandom;
import java.util.Random;
import java.util.function.Supplier;

/**
 * 生成 8 位字母数字会话 ID（62^8 种组合），冲突由注册表重试处理。
 */
public final class SessionIdGenerator implements Supplier<String> {

    private static final char[] ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

    public static final int DEFAULT_LENGTH = 8;

    private final Random random;
    private final int length;

    public SessionIdGenerator() {
        this(new SecureRandom(), DEFAULT_LENGTH);
    }

    public SessionIdGenerator(Random random, int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("length must be positive: " + length);
        }
        this.random = random;
        this.length = length;
    }

    @Override
    public String get() {
        char[] buf = new char[length];
        for (int i = 0; i < length; i++) {
            buf[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(buf);
    }
}
