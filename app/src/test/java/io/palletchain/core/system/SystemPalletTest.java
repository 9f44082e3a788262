package io.palletchain.core.system;

import io.palletchain.core.protocol.Hash;
import io.palletchain.core.support.TestConfig;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.NavigableMap;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SystemPalletTest {

    private static SystemPallet<String, Integer, Integer> newSystem() {
        return new SystemPallet<>(TestConfig.INSTANCE);
    }

    @Test
    void tracksBlockNumberAndNonces() {
        SystemPallet<String, Integer, Integer> system = newSystem();

        system.incBlockNumber();
        system.incNonce("Temi");

        assertEquals(1, system.blockNumber());
        assertEquals(1, system.nonce("Temi"));
        assertEquals(0, system.nonce("Faithful"));
        assertFalse(system.nonces().containsKey("Faithful"));
    }

    @Test
    void nonceKeepsIncrementing() {
        SystemPallet<String, Integer, Integer> system = newSystem();
        for (int i = 0; i < 5; i++) {
            system.incNonce("alice");
        }
        assertEquals(5, system.nonce("alice"));
    }

    @Test
    void genesisAndFirstBlockHashes() {
        SystemPallet<String, Integer, Integer> system = newSystem();

        Hash genesis = system.finalizeBlock();
        assertEquals(0, system.blockNumber());
        assertEquals(Optional.of(genesis), system.getBlockHash(0));
        assertEquals(Optional.of(genesis), system.currentBlockHash());
        assertEquals(Optional.of(genesis), system.genesisHash());

        system.incBlockNumber();
        system.incNonce("Alice");
        system.incNonce("Bob");

        Hash block1 = system.finalizeBlock();
        assertEquals(Optional.of(block1), system.getBlockHash(1));
        assertEquals(Optional.of(block1), system.currentBlockHash());
        assertEquals(Optional.of(genesis), system.parentBlockHash());
        assertNotEquals(genesis, block1);
    }

    @Test
    void hashLayoutEncodesNumberNonceSumAndParentPrefix() {
        SystemPallet<String, Integer, Integer> system = newSystem();
        Hash genesis = system.finalizeBlock();

        system.incBlockNumber();
        system.incNonce("Alice");
        system.incNonce("Bob");
        system.incNonce("Bob");
        byte[] b = system.finalizeBlock().bytes();

        assertArrayEquals(new byte[] {0, 0, 0, 1}, Arrays.copyOfRange(b, 0, 4));
        assertArrayEquals(new byte[] {0, 0, 0, 3}, Arrays.copyOfRange(b, 4, 8));
        assertArrayEquals(genesis.prefix(8), Arrays.copyOfRange(b, 8, 16));
        for (int i = 16; i < 32; i++) {
            assertEquals((byte) (i + 1), b[i]);
        }
    }

    @Test
    void refinalizingWithoutProgressGivesSameHash() {
        SystemPallet<String, Integer, Integer> system = newSystem();

        Hash first = system.finalizeBlock();
        Hash second = system.finalizeBlock();
        assertEquals(first, second);

        system.incBlockNumber();
        system.incNonce("Bob");
        Hash third = system.finalizeBlock();
        assertNotEquals(second, third);
    }

    @Test
    void refinalizingAfterNonceChangeOverwritesStoredHash() {
        SystemPallet<String, Integer, Integer> system = newSystem();
        system.finalizeBlock();
        system.incBlockNumber();
        Hash before = system.finalizeBlock();

        system.incNonce("carol");
        Hash after = system.finalizeBlock();

        assertNotEquals(before, after);
        assertEquals(Optional.of(after), system.getBlockHash(1));
        assertEquals(2, system.allBlockHashes().size());
    }

    @Test
    void parentHashIsEmptyAtGenesis() {
        SystemPallet<String, Integer, Integer> system = newSystem();
        assertEquals(Optional.empty(), system.parentBlockHash());

        Hash genesis = system.finalizeBlock();
        assertEquals(Optional.empty(), system.parentBlockHash());

        system.incBlockNumber();
        assertEquals(Optional.of(genesis), system.parentBlockHash());

        system.finalizeBlock();
        assertEquals(Optional.of(genesis), system.parentBlockHash());
    }

    @Test
    void allBlockHashesIsOrderedAndQueriesAreStable() {
        SystemPallet<String, Integer, Integer> system = newSystem();
        assertTrue(system.allBlockHashes().isEmpty());

        Hash h0 = system.finalizeBlock();
        system.incBlockNumber();
        Hash h1 = system.finalizeBlock();
        system.incBlockNumber();
        Hash h2 = system.finalizeBlock();
        system.incBlockNumber();

        NavigableMap<Integer, Hash> all = system.allBlockHashes();
        assertEquals(3, all.size());
        assertEquals(h0, all.get(0));
        assertEquals(h1, all.get(1));
        assertEquals(h2, all.get(2));
        assertEquals(0, all.firstKey());
        assertEquals(Optional.empty(), system.currentBlockHash());

        assertEquals(system.getBlockHash(1), system.getBlockHash(1));
        assertThrows(UnsupportedOperationException.class, () -> all.remove(0));
    }
}
