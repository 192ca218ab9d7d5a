package com.questrail.cpor.crypto;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

final class CryptoUtilTest
{
    @Test
    void nonceSizeBounds()
    {
        assertEquals(1, CryptoUtil.generateNonce(1).length);
        assertEquals(1024, CryptoUtil.generateNonce(1024).length);
        assertThrows(IllegalArgumentException.class, () -> CryptoUtil.generateNonce(0));
        assertThrows(IllegalArgumentException.class, () -> CryptoUtil.generateNonce(1025));
    }

    @Test
    void noncesDiffer()
    {
        assertFalse(Arrays.equals(CryptoUtil.generateNonce(16), CryptoUtil.generateNonce(16)));
    }

    @Test
    void sessionKeyIs32Bytes()
    {
        assertEquals(32, CryptoUtil.generateSessionKey().length);
    }

    @Test
    void constantTimeEquals()
    {
        assertTrue(CryptoUtil.constantTimeEquals(new byte[] { 1, 2 }, new byte[] { 1, 2 }));
        assertFalse(CryptoUtil.constantTimeEquals(new byte[] { 1, 2 }, new byte[] { 1, 3 }));
        assertFalse(CryptoUtil.constantTimeEquals(new byte[] { 1, 2 }, new byte[] { 1, 2, 3 }));
    }

    @Test
    void keyIdUsesFirstEightBytes()
    {
        byte[] key = new byte[32];
        for (int i = 0; i < key.length; i++) {
            key[i] = (byte) i;
        }

        assertEquals("cpor_0001020304050607", CryptoUtil.deriveKeyId(key));
        assertEquals("node_0001020304050607", CryptoUtil.deriveKeyId(key, "node"));
        assertThrows(IllegalArgumentException.class, () -> CryptoUtil.deriveKeyId(new byte[16]));
    }

    @Test
    void keyValidityChecksNeverThrow()
    {
        java.security.KeyPair generated = Ed25519.generateKeyPair();

        assertTrue(CryptoUtil.isValidEd25519PublicKey(Ed25519.rawPublicKey(generated.getPublic())));
        assertTrue(CryptoUtil.isValidEd25519PrivateKey(Ed25519.rawPrivateKey(generated.getPrivate())));
        assertFalse(CryptoUtil.isValidEd25519PublicKey(new byte[31]));
        assertFalse(CryptoUtil.isValidEd25519PublicKey(null));
        assertFalse(CryptoUtil.isValidEd25519PrivateKey(new byte[33]));
    }
}
