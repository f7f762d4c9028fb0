package com.eyelevel.invoicetransformer.service.transform;

import java.nio.charset.StandardCharsets;

/**
 * The head checksum: 32-bit FNV-1a over the UTF-8 bytes of the invoice number followed by the gross
 * total text, read as an unsigned value, modulo 100000. Stable across runs and platforms.
 */
public final class InvoiceChecksum {

    public static final int MODULUS = 100_000;

    private static final int FNV_OFFSET_BASIS = 0x811C9DC5;
    private static final int FNV_PRIME = 0x01000193;

    private InvoiceChecksum() {
    }

    public static int of(final String invoiceNumber, final String grossTotalText) {
        return (int) (Integer.toUnsignedLong(fnv1a(invoiceNumber + grossTotalText)) % MODULUS);
    }

    static int fnv1a(final String text) {
        int hash = FNV_OFFSET_BASIS;
        for (final byte b : text.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xFF);
            hash *= FNV_PRIME;
        }
        return hash;
    }
}
