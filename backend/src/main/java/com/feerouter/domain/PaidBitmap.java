package com.feerouter.domain;

import java.util.Arrays;

/**
 * Fixed-capacity, immutable set of investor indices paid in the current distribution day.
 * Capacity is the policy's {@code totalInvestors}; bit {@code i} lives in byte {@code i / 8}, position {@code i % 8}.
 */
public final class PaidBitmap {

    /** Upper bound on investors per vault (256 bytes of bitmap). */
    public static final int MAX_CAPACITY = 2048;

    private final int capacity;
    private final byte[] bits;

    private PaidBitmap(int capacity, byte[] bits) {
        this.capacity = capacity;
        this.bits = bits;
    }

    public static PaidBitmap empty(int capacity) {
        checkCapacity(capacity);
        return new PaidBitmap(capacity, new byte[byteLength(capacity)]);
    }

    /**
     * Restores a bitmap from its persisted bytes. A missing or short array is treated as all-clear.
     */
    public static PaidBitmap fromBytes(int capacity, byte[] persisted) {
        checkCapacity(capacity);
        byte[] copy = new byte[byteLength(capacity)];
        if (persisted != null) {
            System.arraycopy(persisted, 0, copy, 0, Math.min(persisted.length, copy.length));
        }
        return new PaidBitmap(capacity, copy);
    }

    public boolean isPaid(int index) {
        checkIndex(index);
        return (bits[index >>> 3] & (1 << (index & 7))) != 0;
    }

    /** Returns a bitmap with {@code index} set; bits are never cleared individually. */
    public PaidBitmap markPaid(int index) {
        checkIndex(index);
        byte[] copy = bits.clone();
        copy[index >>> 3] |= (byte) (1 << (index & 7));
        return new PaidBitmap(capacity, copy);
    }

    public PaidBitmap cleared() {
        return empty(capacity);
    }

    public int paidCount() {
        int count = 0;
        for (byte b : bits) {
            count += Integer.bitCount(b & 0xFF);
        }
        return count;
    }

    public int capacity() {
        return capacity;
    }

    public byte[] toBytes() {
        return bits.clone();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= capacity) {
            throw new IndexOutOfBoundsException("Investor index " + index + " outside [0, " + capacity + ")");
        }
    }

    private static void checkCapacity(int capacity) {
        if (capacity < 1 || capacity > MAX_CAPACITY) {
            throw new IllegalArgumentException("Bitmap capacity must be in [1, " + MAX_CAPACITY + "]: " + capacity);
        }
    }

    private static int byteLength(int capacity) {
        return (capacity + 7) / 8;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PaidBitmap other)) return false;
        return capacity == other.capacity && Arrays.equals(bits, other.bits);
    }

    @Override
    public int hashCode() {
        return 31 * capacity + Arrays.hashCode(bits);
    }

    @Override
    public String toString() {
        return "PaidBitmap[" + paidCount() + "/" + capacity + "]";
    }
}
