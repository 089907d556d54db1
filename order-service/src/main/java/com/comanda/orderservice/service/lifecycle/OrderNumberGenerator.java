package com.comanda.orderservice.service.lifecycle;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Human-readable order numbers: {@code ORD-yyyyMMdd-XXXXXX} (UTC date).
 * The suffix alphabet leaves out 0/O and 1/I/L so numbers can be read out
 * over the phone. Uniqueness is enforced by the column constraint.
 */
@Component
@RequiredArgsConstructor
public class OrderNumberGenerator {

    private static final String ALPHABET = "23456789ABCDEFGHJKMNPQRSTUVWXYZ";
    private static final int SUFFIX_LENGTH = 6;
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final SecureRandom random = new SecureRandom();
    private final Clock clock;

    public String next() {
        StringBuilder number = new StringBuilder("ORD-").append(DATE.format(clock.instant())).append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            number.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return number.toString();
    }
}
