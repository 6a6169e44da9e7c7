package com.ochre.websocket.client;

import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.util.Random;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Mints client request ids: random (version 4) UUIDs from a strong source,
 * falling back to a pseudo-random one where no strong source is available.
 */
@Slf4j
public final class RequestIds {

    private static volatile Random source;

    private RequestIds() {
    }

    public static String next() {
        return next(source());
    }

    static String next(Random random) {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        bytes[6] = (byte) ((bytes[6] & 0x0f) | 0x40);
        bytes[8] = (byte) ((bytes[8] & 0x3f) | 0x80);

        long most = 0;
        long least = 0;
        for (int i = 0; i < 8; i++) {
            most = (most << 8) | (bytes[i] & 0xff);
        }
        for (int i = 8; i < 16; i++) {
            least = (least << 8) | (bytes[i] & 0xff);
        }
        return new UUID(most, least).toString();
    }

    private static Random source() {
        Random current = source;
        if (current == null) {
            synchronized (RequestIds.class) {
                current = source;
                if (current == null) {
                    current = createSource(SecureRandom::new);
                    source = current;
                }
            }
        }
        return current;
    }

    static Random createSource(Supplier<? extends Random> strong) {
        try {
            return strong.get();
        } catch (RuntimeException e) {
            log.warn("No strong random source, request ids fall back to pseudo-random: {}", e.toString());
            return new Random();
        }
    }
}
