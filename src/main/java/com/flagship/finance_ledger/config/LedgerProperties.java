package com.flagship.finance_ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code ledger.*} configuration.
 *
 * <pre>
 * ledger:
 *   shards:
 *     accounts:
 *       url: jdbc:h2:mem:accounts;DB_CLOSE_DELAY=-1
 *       collections: [accounts, account_balances]
 *   migrations:
 *     auto-apply: true
 *   seeds:
 *     enabled: false
 * </pre>
 */
@ConfigurationProperties(prefix = "ledger")
@Validated
@Getter
@Setter
public class LedgerProperties {

    @Valid
    private Map<String, ShardProperties> shards = new LinkedHashMap<>();

    private Migrations migrations = new Migrations();

    private Seeds seeds = new Seeds();

    @Getter
    @Setter
    public static class ShardProperties {
        @NotBlank
        private String url;
        private String username = "sa";
        private String password = "";
        @Min(1)
        private int poolSize = 5;
        private List<String> collections = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Migrations {
        private boolean autoApply = true;
        /** Highest version to apply on startup; all registered versions when unset. */
        private Integer targetVersion;
    }

    @Getter
    @Setter
    public static class Seeds {
        private boolean enabled = false;
    }
}
