package com.zatca.fatoora.crypto;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.Security;

/**
 * Registers the Bouncy Castle JCA provider once per JVM.
 */
public final class CryptoProviders {

    public static final String BOUNCY_CASTLE = BouncyCastleProvider.PROVIDER_NAME;

    private CryptoProviders() {
    }

    public static synchronized String ensureBouncyCastle() {
        if (Security.getProvider(BOUNCY_CASTLE) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
        return BOUNCY_CASTLE;
    }
}
