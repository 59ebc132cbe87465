// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.test;

import java.security.SecureRandom;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;
import java.util.stream.LongStream;

final class RandomUtils {
    private RandomUtils() {
    }

    static LongStream seeds() {
        return LongStream.generate(secureRandom::nextLong).limit(8);
    }

    static RandomGenerator createGenerator(final long seed) {
        return factory.create(seed);
    }

    // Text made of marker characters and line breaks, but never three marker characters in a row.
    static String markerFreeText(final RandomGenerator generator, final int maxLength) {
        final var length = generator.nextInt(1, maxLength + 1);
        final var builder = new StringBuilder(length);
        while (builder.length() < length) {
            final var c = alphabet.charAt(generator.nextInt(alphabet.length()));
            final var size = builder.length();
            if (size >= 2 && builder.charAt(size - 1) == c && builder.charAt(size - 2) == c && "[|]".indexOf(c) >= 0) {
                continue;
            }
            builder.append(c);
        }
        return builder.toString();
    }

    // A run of sibling frames that contain no code of their own, each possibly with nested frames.
    static String textOnlyFrames(final RandomGenerator generator, final int maxCount) {
        final var builder = new StringBuilder();
        final var count = generator.nextInt(maxCount + 1);
        for (int i = 0; i < count; i += 1) {
            builder.append(' ');
            appendTextOnlyFrame(generator, builder, 2);
        }
        return builder.append(' ').toString();
    }

    private static void appendTextOnlyFrame(final RandomGenerator generator, final StringBuilder builder, final int depth) {
        builder.append("[[[");
        if (depth > 0 && generator.nextBoolean()) {
            builder.append(' ');
            appendTextOnlyFrame(generator, builder, depth - 1);
        }
        builder.append(" ||| w").append(generator.nextInt(100)).append(" ]]]");
    }

    private static final String alphabet = "ab [|]\n\tx";
    private static final SecureRandom secureRandom = new SecureRandom();
    private static final RandomGeneratorFactory<?> factory = RandomGeneratorFactory.of("L32X64MixRandom");
}
