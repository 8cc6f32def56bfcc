package com.flagship.ledger_resolver.pool;

import com.flagship.ledger_resolver.exception.PoolConfigException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * On-disk pool configuration: {@code <root>/<pool>/genesis} holds the configured
 * genesis transactions and {@code <root>/<pool>/cache-<hash>} the pool
 * transactions last refreshed from the network for that genesis.
 */
@Slf4j
public class GenesisStore {

    private static final String GENESIS_FILE = "genesis";

    private final Path root;

    /**
     * @param root configuration root, or null to keep nothing on disk
     */
    public GenesisStore(Path root) {
        this.root = root;
    }

    /**
     * Trims every line and drops blank ones.
     */
    public static String normalize(String transactions) {
        StringBuilder lines = new StringBuilder();
        for (String line : transactions.split("\\R")) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty()) {
                lines.append(trimmed).append('\n');
            }
        }
        return lines.toString();
    }

    /**
     * Last 16 hex characters of the SHA-256 of the transactions.
     */
    public static String hash(String transactions) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(transactions.getBytes(StandardCharsets.UTF_8));
            String hex = HexFormat.of().formatHex(digest);
            return hex.substring(hex.length() - 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Returns the normalized genesis transactions for the pool, writing inline
     * transactions through to disk and reading them back from disk otherwise.
     *
     * @throws PoolConfigException if no genesis transactions are available
     */
    public String resolveGenesis(LedgerPoolConfig config) {
        String inline = config.getGenesisTransactions();
        if (inline != null && !inline.isBlank()) {
            String genesis = normalize(inline);
            writeGenesis(config.getName(), genesis);
            return genesis;
        }
        if (root == null) {
            throw new PoolConfigException("Pool config '" + config.getName() + "' not found");
        }
        Path genesisPath = root.resolve(config.getName()).resolve(GENESIS_FILE);
        try {
            String genesis = normalize(Files.readString(genesisPath, StandardCharsets.UTF_8));
            if (genesis.isEmpty()) {
                throw new PoolConfigException("Empty genesis transactions for pool '" + config.getName() + "'");
            }
            return genesis;
        } catch (NoSuchFileException e) {
            throw new PoolConfigException("Pool config '" + config.getName() + "' not found");
        } catch (IOException e) {
            throw new PoolConfigException("Error reading genesis transactions for pool '" + config.getName() + "'", e);
        }
    }

    /**
     * Writes the genesis file unless an identical one is already present.
     */
    void writeGenesis(String poolName, String genesis) {
        if (genesis.isEmpty()) {
            throw new PoolConfigException("Empty genesis transactions");
        }
        if (root == null) {
            return;
        }
        Path poolDir = root.resolve(poolName);
        Path genesisPath = poolDir.resolve(GENESIS_FILE);
        try {
            Files.createDirectories(poolDir);
            if (Files.exists(genesisPath)
                    && normalize(Files.readString(genesisPath, StandardCharsets.UTF_8)).equals(genesis)) {
                log.debug("Pool ledger config '{}' is consistent, skipping write", poolName);
                return;
            }
            writeAtomically(genesisPath, genesis);
            log.debug("Wrote pool ledger config '{}'", poolName);
        } catch (IOException e) {
            throw new PoolConfigException("Error writing genesis transactions", e);
        }
    }

    public Optional<String> readCachedTransactions(String poolName, String genesisHash) {
        if (root == null) {
            return Optional.empty();
        }
        Path cachePath = root.resolve(poolName).resolve("cache-" + genesisHash);
        try {
            return Optional.of(Files.readString(cachePath, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Error reading cached transactions for pool {}: {}", poolName, e.getMessage());
            return Optional.empty();
        }
    }

    public void writeCachedTransactions(String poolName, String genesisHash, String transactions) {
        if (root == null) {
            return;
        }
        Path poolDir = root.resolve(poolName);
        try {
            Files.createDirectories(poolDir);
            writeAtomically(poolDir.resolve("cache-" + genesisHash), transactions);
        } catch (IOException e) {
            log.error("Error writing cached genesis transactions for pool {}", poolName, e);
        }
    }

    private static void writeAtomically(Path target, String content) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
