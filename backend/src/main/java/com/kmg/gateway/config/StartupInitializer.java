package com.kmg.gateway.config;

import com.kmg.gateway.provider.ProviderRegistry;
import com.kmg.gateway.service.ReservationReconciler;
import com.kmg.gateway.service.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class StartupInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupInitializer.class);

    private final GatewayProperties properties;
    private final JdbcTemplate jdbcTemplate;
    private final ServiceRegistry serviceRegistry;
    private final ProviderRegistry providerRegistry;
    private final ReservationReconciler reservationReconciler;

    public StartupInitializer(
            GatewayProperties properties,
            JdbcTemplate jdbcTemplate,
            ServiceRegistry serviceRegistry,
            ProviderRegistry providerRegistry,
            ReservationReconciler reservationReconciler
    ) {
        this.properties = properties;
        this.jdbcTemplate = jdbcTemplate;
        this.serviceRegistry = serviceRegistry;
        this.providerRegistry = providerRegistry;
        this.reservationReconciler = reservationReconciler;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        createDirectories();
        initializeSchema();
        serviceRegistry.syncFromConfig(properties.getServices());
        warnAboutUnknownProviders();
        reservationReconciler.recoverAfterRestart();
    }

    private void createDirectories() throws IOException {
        Files.createDirectories(Path.of(properties.getLogs().getDir()));
        Path dbPath = Path.of(properties.getState().getDbPath());
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }
    }

    private void initializeSchema() {
        configureSqlitePragmas();

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS services (
              id TEXT PRIMARY KEY,
              name TEXT NOT NULL,
              is_active INTEGER NOT NULL DEFAULT 1,
              cost INTEGER NOT NULL DEFAULT 1,
              created_at TEXT NOT NULL,
              updated_at TEXT NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS service_fallback_chain (
              service_id TEXT NOT NULL,
              position INTEGER NOT NULL,
              provider_id TEXT NOT NULL,
              PRIMARY KEY (service_id, position),
              FOREIGN KEY (service_id) REFERENCES services(id)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS api_keys (
              id TEXT PRIMARY KEY,
              caller_id TEXT NOT NULL,
              key_hash TEXT UNIQUE NOT NULL,
              label TEXT,
              is_active INTEGER NOT NULL DEFAULT 1,
              created_at TEXT NOT NULL,
              last_used_at TEXT
            )
            """);

        // service_id may be the '*' wildcard, so it does not reference services.
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS api_key_services (
              key_id TEXT NOT NULL,
              service_id TEXT NOT NULL,
              PRIMARY KEY (key_id, service_id),
              FOREIGN KEY (key_id) REFERENCES api_keys(id)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS credit_accounts (
              caller_id TEXT PRIMARY KEY,
              balance INTEGER NOT NULL DEFAULT 0 CHECK (balance >= 0),
              version INTEGER NOT NULL DEFAULT 0,
              updated_at TEXT NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS credit_reservations (
              id TEXT PRIMARY KEY,
              caller_id TEXT NOT NULL,
              amount INTEGER NOT NULL,
              state TEXT NOT NULL,
              created_at TEXT NOT NULL,
              settled_at TEXT,
              FOREIGN KEY (caller_id) REFERENCES credit_accounts(caller_id)
            )
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_credit_reservations_state
              ON credit_reservations(state, created_at)
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS credit_audit (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              caller_id TEXT NOT NULL,
              old_balance INTEGER NOT NULL,
              new_balance INTEGER NOT NULL,
              reason TEXT NOT NULL,
              created_at TEXT NOT NULL,
              FOREIGN KEY (caller_id) REFERENCES credit_accounts(caller_id)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS verification_records (
              service_id TEXT NOT NULL,
              lookup_key TEXT NOT NULL,
              payload_json TEXT NOT NULL,
              source TEXT NOT NULL,
              fetched_at TEXT NOT NULL,
              PRIMARY KEY (service_id, lookup_key)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS usage_logs (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              caller_id TEXT,
              key_id TEXT,
              service_id TEXT NOT NULL,
              lookup_key TEXT NOT NULL,
              outcome TEXT NOT NULL,
              failure_code TEXT,
              source TEXT,
              credits_charged INTEGER NOT NULL DEFAULT 0,
              response_time_ms INTEGER NOT NULL DEFAULT 0,
              created_at TEXT NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_usage_logs_caller
              ON usage_logs(caller_id, id)
            """);
    }

    private void configureSqlitePragmas() {
        try {
            jdbcTemplate.queryForObject("PRAGMA journal_mode=WAL", String.class);
            jdbcTemplate.execute("PRAGMA synchronous=NORMAL");
            jdbcTemplate.execute("PRAGMA foreign_keys=ON");
            jdbcTemplate.execute("PRAGMA busy_timeout=30000");
        } catch (Exception e) {
            log.warn("Failed to configure SQLite pragmas: {}", e.getMessage());
        }
    }

    private void warnAboutUnknownProviders() {
        for (GatewayProperties.Service service : properties.getServices()) {
            for (String providerId : service.getFallbackChain()) {
                if (!providerRegistry.contains(providerId)) {
                    log.warn("Service {} lists provider {} which is not configured; it will be skipped",
                            service.getId(), providerId);
                }
            }
        }
    }
}
