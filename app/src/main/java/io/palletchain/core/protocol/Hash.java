package io.palletchain.core.protocol;

import java.util.Arrays;

/** Opaque 32-byte block hash. Immutable; bytes are copied in and out. */
public final class Hash {
    public static final int LENGTH = 32;
    private final byte[] bytes;

    public Hash(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Hash must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    public byte[] bytes() { return bytes.clone(); }

    /** First {@code n} bytes (n <= 32). */
    public byte[] prefix(int n) { return Arrays.copyOf(bytes, n); }

    public String hex() { return toHex(bytes, LENGTH); }

    /** Hex of the first 8 bytes, for log lines. */
    public String shortHex() { return toHex(bytes, 8); }

    private static String toHex(byte[] b, int len){
        final char[] HEX="0123456789abcdef".toCharArray();
        char[] out=new char[len*2];
        for(int i=0,j=0;i<len;i++){int v=b[i]&0xff;out[j++]=HEX[v>>>4];out[j++]=HEX[v&0x0f];}
        return new String(out);
    }

    @Override public boolean equals(Object o){ return o instanceof Hash other && Arrays.equals(bytes, other.bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "Hash("+shortHex()+"…)"; }
}
