package com.billsync.relay;

import com.billsync.protocol.PairingCodes;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

@Component
public class PairingCodeGenerator {

    private final SecureRandom random = new SecureRandom();

    /** Uniform in [100000, 999999]. */
    public String nextCode() {
        int span = PairingCodes.HIGHEST - PairingCodes.LOWEST + 1;
        return Integer.toString(PairingCodes.LOWEST + random.nextInt(span));
    }
}
