package com.github.rewrite.solidity.namespace;

import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Storage locations of ERC-7201 namespaces.
 */
public final class Erc7201 {

    public static final String STORAGE_LOCATION_TAG = "@custom:storage-location";
    public static final String FORMULA_ID = "erc7201";

    private Erc7201() {
        // Utility class
    }

    /**
     * @return the annotation declaring a struct as the storage of namespace {@code id}, e.g.
     * {@code @custom:storage-location erc7201:example.main}
     */
    public static String storageLocationAnnotation(String id) {
        return STORAGE_LOCATION_TAG + " " + FORMULA_ID + ":" + id;
    }

    /**
     * Computes {@code keccak256(abi.encode(uint256(keccak256(id)) - 1)) & ~bytes32(uint256(0xff))}.
     *
     * @return the slot as {@code 0x} followed by 64 lower-case hex digits
     */
    public static String storageSlot(String id) {
        byte[] idHash = keccak256(id.getBytes(StandardCharsets.UTF_8));
        BigInteger decremented = new BigInteger(1, idHash).subtract(BigInteger.ONE);
        byte[] slot = keccak256(toUint256(decremented));
        slot[slot.length - 1] = 0;
        return "0x" + Hex.toHexString(slot);
    }

    private static byte[] keccak256(byte[] input) {
        return new Keccak.Digest256().digest(input);
    }

    private static byte[] toUint256(BigInteger value) {
        byte[] raw = value.toByteArray();
        byte[] word = new byte[32];
        int length = Math.min(raw.length, 32);
        System.arraycopy(raw, raw.length - length, word, 32 - length, length);
        return word;
    }
}
