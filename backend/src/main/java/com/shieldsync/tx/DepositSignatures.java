package com.shieldsync.tx;

import com.shieldsync.common.TxInvalidArgumentException;

import java.util.Locale;

/**
 * Assembles the depositSignature field sent with a deposit: optional sender address followed by the
 * signature over the nullifier, the signature optionally in EIP-2098 compact form.
 */
final class DepositSignatures {

    private static final int FULL_HEX_LENGTH = 130;
    private static final int COMPACT_HEX_LENGTH = 128;

    private DepositSignatures() {
    }

    static String assemble(String fromAddress, String signature, boolean compact) {
        String sig = compact ? toCompact(signature) : signature;
        if (fromAddress == null || fromAddress.isBlank()) {
            return sig;
        }
        return ensurePrefix(fromAddress.trim()) + strip0x(sig);
    }

    /**
     * 65-byte {@code r || s || v} to 64-byte {@code r || yParityAndS}; the parity bit is folded into the top bit of s.
     * Signatures already in compact form pass through.
     */
    static String toCompact(String signature) {
        String hex = strip0x(signature).toLowerCase(Locale.ROOT);
        if (hex.length() == COMPACT_HEX_LENGTH) {
            return "0x" + hex;
        }
        if (hex.length() != FULL_HEX_LENGTH) {
            throw new TxInvalidArgumentException("Deposit signature must be 65 bytes, got " + hex.length() / 2);
        }
        int v = Integer.parseInt(hex.substring(128, 130), 16);
        int yParity = v >= 27 ? v - 27 : v;
        if (yParity != 0 && yParity != 1) {
            throw new TxInvalidArgumentException("Deposit signature has invalid recovery id " + v);
        }
        String r = hex.substring(0, 64);
        String s = hex.substring(64, 128);
        if (yParity == 1) {
            int high = Character.digit(s.charAt(0), 16) | 0x8;
            s = Character.forDigit(high, 16) + s.substring(1);
        }
        return "0x" + r + s;
    }

    private static String strip0x(String hex) {
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }

    private static String ensurePrefix(String hex) {
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex : "0x" + hex;
    }
}
