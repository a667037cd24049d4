package com.quickdeploy.back.crypto;

import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.bouncycastle.crypto.engines.Salsa20Engine;
import org.bouncycastle.crypto.engines.XSalsa20Engine;
import org.bouncycastle.crypto.macs.Poly1305;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;
import org.bouncycastle.util.Pack;

import java.security.SecureRandom;

/**
 * Anonymous public-key encryption compatible with libsodium's {@code crypto_box_seal},
 * the format GitHub expects for Actions secrets.
 * <p>
 * Output layout: ephemeral public key (32) | Poly1305 tag (16) | XSalsa20 ciphertext.
 */
public final class SealedBox {

    public static final int KEY_BYTES = 32;
    public static final int SEAL_BYTES = KEY_BYTES + 16;

    static final int MAC_BYTES = 16;
    private static final int NONCE_BYTES = 24;

    // "expand 32-byte k"
    private static final int[] SIGMA = {0x61707865, 0x3320646e, 0x79622d32, 0x6b206574};

    private static final SecureRandom RNG = new SecureRandom();

    private SealedBox() {
    }

    public static byte[] seal(byte[] message, byte[] recipientPublicKey) {
        return seal(message, recipientPublicKey, new X25519PrivateKeyParameters(RNG).getEncoded());
    }

    /**
     * Seals with a caller supplied ephemeral key. Only for reproducible output in tests.
     */
    static byte[] seal(byte[] message, byte[] recipientPublicKey, byte[] ephemeralPrivateKey) {
        requireKey(recipientPublicKey, "recipient public key");
        requireKey(ephemeralPrivateKey, "ephemeral private key");

        X25519PrivateKeyParameters ephemeral = new X25519PrivateKeyParameters(ephemeralPrivateKey, 0);
        byte[] ephemeralPublic = ephemeral.generatePublicKey().getEncoded();

        byte[] nonce = nonce(ephemeralPublic, recipientPublicKey);
        byte[] key = boxKey(ephemeralPrivateKey, recipientPublicKey);

        XSalsa20Engine cipher = cipher(key, nonce);
        Poly1305 mac = mac(cipher);

        byte[] out = new byte[SEAL_BYTES + message.length];
        System.arraycopy(ephemeralPublic, 0, out, 0, KEY_BYTES);
        cipher.processBytes(message, 0, message.length, out, SEAL_BYTES);
        mac.update(out, SEAL_BYTES, message.length);
        mac.doFinal(out, KEY_BYTES);
        return out;
    }

    static byte[] nonce(byte[] ephemeralPublic, byte[] recipientPublic) {
        Blake2bDigest digest = new Blake2bDigest(null, NONCE_BYTES, null, null);
        digest.update(ephemeralPublic, 0, ephemeralPublic.length);
        digest.update(recipientPublic, 0, recipientPublic.length);
        byte[] nonce = new byte[NONCE_BYTES];
        digest.doFinal(nonce, 0);
        return nonce;
    }

    /**
     * crypto_box_beforenm: HSalsa20 over the X25519 shared secret with a zero nonce.
     */
    static byte[] boxKey(byte[] privateKey, byte[] publicKey) {
        X25519Agreement agreement = new X25519Agreement();
        agreement.init(new X25519PrivateKeyParameters(privateKey, 0));
        byte[] shared = new byte[agreement.getAgreementSize()];
        agreement.calculateAgreement(new X25519PublicKeyParameters(publicKey, 0), shared, 0);
        return hsalsa20(shared);
    }

    private static byte[] hsalsa20(byte[] key) {
        int[] state = new int[16];
        state[0] = SIGMA[0];
        state[5] = SIGMA[1];
        state[10] = SIGMA[2];
        state[15] = SIGMA[3];
        Pack.littleEndianToInt(key, 0, state, 1, 4);
        Pack.littleEndianToInt(key, 16, state, 11, 4);
        // words 6..9 hold the nonce, all zero here

        int[] x = new int[16];
        Salsa20Engine.salsaCore(20, state, x);

        // salsaCore adds the input words back in, HSalsa20 does not
        int[] words = {
                x[0] - state[0], x[5] - state[5], x[10] - state[10], x[15] - state[15],
                x[6] - state[6], x[7] - state[7], x[8] - state[8], x[9] - state[9]
        };
        byte[] subkey = new byte[KEY_BYTES];
        Pack.intToLittleEndian(words, subkey, 0);
        return subkey;
    }

    static XSalsa20Engine cipher(byte[] key, byte[] nonce) {
        XSalsa20Engine cipher = new XSalsa20Engine();
        cipher.init(true, new ParametersWithIV(new KeyParameter(key), nonce));
        return cipher;
    }

    /**
     * Keys Poly1305 with the first 32 keystream bytes, leaving the cipher positioned for the payload.
     */
    static Poly1305 mac(XSalsa20Engine cipher) {
        byte[] macKey = new byte[KEY_BYTES];
        cipher.processBytes(new byte[KEY_BYTES], 0, KEY_BYTES, macKey, 0);
        Poly1305 mac = new Poly1305();
        mac.init(new KeyParameter(macKey));
        return mac;
    }

    private static void requireKey(byte[] key, String what) {
        if (key == null || key.length != KEY_BYTES) {
            throw new IllegalArgumentException("Invalid " + what + ": expected " + KEY_BYTES + " bytes");
        }
    }
}
