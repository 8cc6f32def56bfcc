package com.flagship.ledger_resolver.pool;

import com.flagship.ledger_resolver.exception.PoolConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GenesisStoreTest {

    private static final String GENESIS = "  {\"txn\":1}  \n\n{\"txn\":2}\n   \n";

    @TempDir
    Path root;

    private static LedgerPoolConfig config(String genesis) {
        return LedgerPoolConfig.builder().name("bcovrin").genesisTransactions(genesis).build();
    }

    @Test
    @DisplayName("Normalization trims lines and drops blank ones")
    void normalize() {
        assertEquals("{\"txn\":1}\n{\"txn\":2}\n", GenesisStore.normalize(GENESIS));
    }

    @Test
    @DisplayName("Inline genesis is written through and read back when the blob is absent")
    void writeThroughAndReadBack() throws Exception {
        GenesisStore store = new GenesisStore(root);

        String resolved = store.resolveGenesis(config(GENESIS));
        Path written = root.resolve("bcovrin").resolve("genesis");

        assertEquals(GenesisStore.normalize(GENESIS), resolved);
        assertEquals(resolved, Files.readString(written, StandardCharsets.UTF_8));
        assertEquals(resolved, store.resolveGenesis(config(null)));
    }

    @Test
    @DisplayName("A changed genesis replaces the stored one")
    void changedGenesisIsRewritten() throws Exception {
        GenesisStore store = new GenesisStore(root);
        store.resolveGenesis(config(GENESIS));

        store.resolveGenesis(config("{\"txn\":3}"));

        assertEquals("{\"txn\":3}\n",
                Files.readString(root.resolve("bcovrin").resolve("genesis"), StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("No blob and no stored file is a configuration error")
    void missingGenesis() {
        assertThrows(PoolConfigException.class, () -> new GenesisStore(root).resolveGenesis(config(null)));
        assertThrows(PoolConfigException.class, () -> new GenesisStore(null).resolveGenesis(config(null)));
    }

    @Test
    @DisplayName("Refreshed transactions are cached per genesis hash")
    void cachedTransactions() {
        GenesisStore store = new GenesisStore(root);
        String hash = GenesisStore.hash(GenesisStore.normalize(GENESIS));

        assertTrue(store.readCachedTransactions("bcovrin", hash).isEmpty());
        store.writeCachedTransactions("bcovrin", hash, "{\"txn\":9}\n");

        assertEquals("{\"txn\":9}\n", store.readCachedTransactions("bcovrin", hash).orElseThrow());
        assertTrue(store.readCachedTransactions("bcovrin", "0000000000000000").isEmpty());
        assertEquals(16, hash.length());
    }
}
