package io.palletchain.core.support;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.Optional;

/**
 * Numeric capabilities a pallet needs from an associated type (block numbers, nonces, balances).
 * - checked operations return empty instead of wrapping
 * - every provided instance is unsigned: subtracting below zero is an underflow
 */
public interface Arithmetic<T> extends Comparator<T> {

    T zero();

    T one();

    /** Largest representable value (used for saturation). */
    T max();

    Optional<T> checkedAdd(T a, T b);

    Optional<T> checkedSub(T a, T b);

    Optional<T> checkedMul(T a, T b);

    /** Integer division; throws ArithmeticException on a zero divisor. */
    T divide(T a, T b);

    T fromLong(long value);

    BigInteger toBigInteger(T value);

    default boolean isZero(T value) {
        return compare(value, zero()) == 0;
    }

    default boolean lessThan(T a, T b) {
        return compare(a, b) < 0;
    }

    /** Unsigned 32-bit values carried in an Integer (0 .. 2^32-1). */
    Arithmetic<Integer> UINT32 = new Arithmetic<>() {
        private static final long LIMIT = 0xFFFF_FFFFL;

        @Override public Integer zero() { return 0; }
        @Override public Integer one() { return 1; }
        @Override public Integer max() { return (int) LIMIT; }

        @Override
        public Optional<Integer> checkedAdd(Integer a, Integer b) {
            return bounded(unsigned(a) + unsigned(b));
        }

        @Override
        public Optional<Integer> checkedSub(Integer a, Integer b) {
            return bounded(unsigned(a) - unsigned(b));
        }

        @Override
        public Optional<Integer> checkedMul(Integer a, Integer b) {
            return bounded(unsigned(a) * unsigned(b)); // (2^32-1)^2 < 2^64, so a wrapped product reads negative
        }

        @Override
        public Integer divide(Integer a, Integer b) {
            return (int) (unsigned(a) / unsigned(b));
        }

        @Override
        public Integer fromLong(long value) {
            if (value < 0 || value > LIMIT) throw new IllegalArgumentException("out of u32 range: " + value);
            return (int) value;
        }

        @Override
        public BigInteger toBigInteger(Integer value) {
            return BigInteger.valueOf(unsigned(value));
        }

        @Override
        public int compare(Integer a, Integer b) {
            return Integer.compareUnsigned(a, b);
        }

        private long unsigned(Integer v) {
            return Integer.toUnsignedLong(v);
        }

        private Optional<Integer> bounded(long v) {
            if (v < 0 || v > LIMIT) return Optional.empty();
            return Optional.of((int) v);
        }
    };

    /** Non-negative longs (0 .. Long.MAX_VALUE). */
    Arithmetic<Long> UINT64 = new Arithmetic<>() {
        @Override public Long zero() { return 0L; }
        @Override public Long one() { return 1L; }
        @Override public Long max() { return Long.MAX_VALUE; }

        @Override
        public Optional<Long> checkedAdd(Long a, Long b) {
            try {
                return Optional.of(Math.addExact(a, b));
            } catch (ArithmeticException e) {
                return Optional.empty();
            }
        }

        @Override
        public Optional<Long> checkedSub(Long a, Long b) {
            long r = a - b;
            return r < 0 ? Optional.empty() : Optional.of(r);
        }

        @Override
        public Optional<Long> checkedMul(Long a, Long b) {
            try {
                return Optional.of(Math.multiplyExact(a, b));
            } catch (ArithmeticException e) {
                return Optional.empty();
            }
        }

        @Override
        public Long divide(Long a, Long b) {
            return a / b;
        }

        @Override
        public Long fromLong(long value) {
            if (value < 0) throw new IllegalArgumentException("negative value: " + value);
            return value;
        }

        @Override
        public BigInteger toBigInteger(Long value) {
            return BigInteger.valueOf(value);
        }

        @Override
        public int compare(Long a, Long b) {
            return Long.compare(a, b);
        }
    };

    /** Unsigned 128-bit values carried in a BigInteger (0 .. 2^128-1). */
    Arithmetic<BigInteger> UINT128 = new Arithmetic<>() {
        private final BigInteger limit = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

        @Override public BigInteger zero() { return BigInteger.ZERO; }
        @Override public BigInteger one() { return BigInteger.ONE; }
        @Override public BigInteger max() { return limit; }

        @Override
        public Optional<BigInteger> checkedAdd(BigInteger a, BigInteger b) {
            return bounded(a.add(b));
        }

        @Override
        public Optional<BigInteger> checkedSub(BigInteger a, BigInteger b) {
            return bounded(a.subtract(b));
        }

        @Override
        public Optional<BigInteger> checkedMul(BigInteger a, BigInteger b) {
            return bounded(a.multiply(b));
        }

        @Override
        public BigInteger divide(BigInteger a, BigInteger b) {
            return a.divide(b);
        }

        @Override
        public BigInteger fromLong(long value) {
            if (value < 0) throw new IllegalArgumentException("negative value: " + value);
            return BigInteger.valueOf(value);
        }

        @Override
        public BigInteger toBigInteger(BigInteger value) {
            return value;
        }

        @Override
        public int compare(BigInteger a, BigInteger b) {
            return a.compareTo(b);
        }

        private Optional<BigInteger> bounded(BigInteger v) {
            if (v.signum() < 0 || v.compareTo(limit) > 0) return Optional.empty();
            return Optional.of(v);
        }
    };
}
