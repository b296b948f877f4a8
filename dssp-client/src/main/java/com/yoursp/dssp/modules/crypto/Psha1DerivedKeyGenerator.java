package com.yoursp.dssp.modules.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Objects;

/**
 * WS-Trust P_SHA-1 key derivation.
 * <ul>
 * <li>secret: the requestor (client) entropy</li>
 * <li>seed: the issuer (server) entropy</li>
 * <li>A(0) = seed, A(i) = HMAC-SHA1(secret, A(i-1))</li>
 * <li>output = HMAC-SHA1(secret, A(1) || seed) || HMAC-SHA1(secret, A(2) || seed) || ...</li>
 * </ul>
 * The output is truncated to the requested key size.
 */
public final class Psha1DerivedKeyGenerator {

    private static final String ALGORITHM = "HmacSHA1";

    private Psha1DerivedKeyGenerator() {
        // utility class
    }

    /**
     * Derive the shared session key.
     *
     * @param clientNonce   entropy sent by the client in the token request
     * @param serverEntropy entropy returned by the service
     * @param keySizeBits   requested key size, positive and a multiple of 8
     * @return exactly {@code keySizeBits / 8} bytes
     */
    public static byte[] deriveKey(byte[] clientNonce, byte[] serverEntropy, int keySizeBits) {
        Objects.requireNonNull(clientNonce, "clientNonce");
        Objects.requireNonNull(serverEntropy, "serverEntropy");
        if (keySizeBits <= 0 || keySizeBits % 8 != 0) {
            throw new IllegalArgumentException("Key size must be a positive multiple of 8 bits: " + keySizeBits);
        }

        int keySize = keySizeBits / 8;
        byte[] key = new byte[keySize];
        try {
            Mac hmac = Mac.getInstance(ALGORITHM);
            hmac.init(new SecretKeySpec(clientNonce, ALGORITHM));

            byte[] a = serverEntropy;
            int offset = 0;
            while (offset < keySize) {
                a = hmac.doFinal(a);

                hmac.update(a);
                hmac.update(serverEntropy);
                byte[] block = hmac.doFinal();

                int length = Math.min(block.length, keySize - offset);
                System.arraycopy(block, 0, key, offset, length);
                offset += length;
            }
            return key;
        } catch (GeneralSecurityException e) {
            Arrays.fill(key, (byte) 0);
            throw new IllegalStateException("P_SHA-1 key derivation failed", e);
        }
    }
}
