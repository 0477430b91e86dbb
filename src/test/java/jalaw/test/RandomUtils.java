// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.test;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.nio.ByteOrder;
import java.security.SecureRandom;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

final class RandomUtils {
    private RandomUtils() {
    }

    static RandomGenerator createGenerator(final long seed) {
        return factory.create(seed);
    }

    static long generateRandomSeed() {
        return SeedGenerator.generateSeed();
    }

    /**
     * Picks a short run of characters from a small alphabet mixing kana, kanji, ASCII and XML metacharacters.
     */
    static String generateText(final RandomGenerator random) {
        final var length = random.nextInt(1, 6);
        final var builder = new StringBuilder(length);
        for (int i = 0; i < length; i += 1) {
            builder.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return builder.toString();
    }

    private static final String alphabet = "あいう法律第一条 ab1&<>\"'";
    private static final RandomGeneratorFactory<?> factory = RandomGeneratorFactory.of("L32X64MixRandom");

    private static final class SeedGenerator {
        private static long generateSeed() {
            final var bytes = new byte[Long.BYTES];
            secureRandom.nextBytes(bytes);
            return (long) longView.get(bytes, 0);
        }

        private static final SecureRandom secureRandom = new SecureRandom();
        private static final VarHandle longView =
            MethodHandles.byteArrayViewVarHandle(long[].class, ByteOrder.nativeOrder()).withInvokeExactBehavior();
    }
}
