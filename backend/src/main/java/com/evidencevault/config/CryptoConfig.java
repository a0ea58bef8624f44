package com.evidencevault.config;

import java.security.SecureRandom;
import java.security.Security;
import java.time.Clock;

import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers BouncyCastle as a JCA provider; every cipher in the vault is
 * requested from the "BC" provider.
 */
@Configuration
public class CryptoConfig {

    static {
        registerBouncyCastle();
    }

    public static synchronized void registerBouncyCastle() {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
