package com.skillswap.billing.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.StringJoiner;

/**
 * Generates payment references: {@code <PREFIX>_<part>..._<epochMillis>_<8 hex chars>}.
 */
@Component
@RequiredArgsConstructor
public class TxRefGenerator {

    public static final String SUBSCRIPTION = "SUB";
    public static final String RENEWAL = "RENEW";
    public static final String TOPUP = "TOPUP";
    public static final String DEDUCTION = "DEDUCT";
    public static final String EARNINGS = "EARN";
    public static final String COURSE = "COURSE";

    private final SecureRandom random = new SecureRandom();
    private final Clock clock;

    public String generate(String prefix, Object... parts) {
        StringJoiner ref = new StringJoiner("_");
        ref.add(prefix);
        for (Object part : parts) {
            ref.add(String.valueOf(part));
        }
        byte[] suffix = new byte[4];
        random.nextBytes(suffix);
        ref.add(String.valueOf(clock.millis()));
        ref.add(HexFormat.of().formatHex(suffix));
        return ref.toString();
    }
}
