package com.example.backup.infrastructure.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 체크섬 (16진수 소문자)
 */
public final class Checksums {

    private static final String ALGORITHM = "SHA-256";

    private Checksums() {
    }

    public static String sha256(byte[] content) {
        MessageDigest digest = newDigest();
        return toHex(digest.digest(content));
    }

    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String toHex(byte[] hashBytes) {
        StringBuilder sb = new StringBuilder(hashBytes.length * 2);
        for (byte b : hashBytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
