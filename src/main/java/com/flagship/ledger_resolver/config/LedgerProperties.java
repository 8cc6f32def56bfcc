package com.flagship.ledger_resolver.config;

import com.flagship.ledger_resolver.exception.PoolConfigException;
import com.flagship.ledger_resolver.registry.LedgerConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings under {@code ledger.*}.
 */
@Data
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /** Root of the per-pool genesis and transaction cache files; none when unset. */
    private String genesisDir;

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Lookup lookup = new Lookup();

    private Close close = new Close();

    private Cache cache = new Cache();

    private List<Ledger> ledgers = new ArrayList<>();

    @Data
    public static class Lookup {
        private int maxWorkers = 5;
        private Duration taskTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Close {
        private int attempts = 3;
        private Duration backoff = Duration.ofMillis(10);
    }

    @Data
    public static class Cache {
        private CacheType type = CacheType.MEMORY;
        private Duration ttl = Duration.ofSeconds(600);
        private long maxEntries = 10_000;
    }

    public enum CacheType {
        MEMORY, REDIS, NONE
    }

    @Data
    public static class Ledger {
        private String id;
        private String poolName;
        private boolean production = true;
        private boolean write;
        private String genesisTransactions;
        private String genesisFile;
        private int keepalive = 5;
        private boolean readOnly;
        private String socksProxy;
        private String endorserDid;
        private String endorserAlias;
        private String gatewayUrl;
        private Duration requestTimeout = Duration.ofSeconds(10);

        /**
         * @throws PoolConfigException if {@code genesis-file} is set but cannot be read
         */
        public LedgerConfig toLedgerConfig() {
            return LedgerConfig.builder()
                    .id(id)
                    .poolName(poolName)
                    .production(production)
                    .write(write)
                    .genesisTransactions(genesisTransactions != null ? genesisTransactions : readGenesisFile())
                    .keepalive(keepalive)
                    .readOnly(readOnly)
                    .socksProxy(socksProxy)
                    .endorserDid(endorserDid)
                    .endorserAlias(endorserAlias)
                    .gatewayUrl(gatewayUrl)
                    .requestTimeout(requestTimeout)
                    .build();
        }

        private String readGenesisFile() {
            if (genesisFile == null || genesisFile.isBlank()) {
                return null;
            }
            try {
                return Files.readString(Path.of(genesisFile), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new PoolConfigException("Error reading genesis file " + genesisFile
                        + " for ledger '" + (id != null ? id : poolName) + "'", e);
            }
        }
    }
}
