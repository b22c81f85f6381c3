/*
 * Copyright (c) 2026 MakiBytes.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package de.makibytes.bankingstage.storage;

import java.io.IOException;
import java.io.StringReader;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.Properties;

import org.postgresql.PGConnection;
import org.postgresql.copy.CopyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import de.makibytes.bankingstage.config.BankingStageProperties;
import de.makibytes.bankingstage.model.BlockInfo;
import de.makibytes.bankingstage.model.TransactionInfo;

/**
 * Bulk loads records with {@code COPY ... FROM STDIN} over a single dedicated
 * connection. The connection is never re-established: once it breaks every write
 * fails with {@link StorageConnectionLostException}.
 */
public class PostgresBankingStageStore implements BankingStageStore {

    private static final Logger logger = LoggerFactory.getLogger(PostgresBankingStageStore.class);

    private final Connection connection;
    private final CopyManager copyManager;
    private final String transactionCopyStatement;
    private final String blockCopyStatement;
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    PostgresBankingStageStore(Connection connection, String schema) throws SQLException {
        this.connection = connection;
        this.copyManager = connection.unwrap(PGConnection.class).getCopyAPI();
        this.transactionCopyStatement = copyStatement(schema, "transaction_infos", TransactionRecord.COLUMNS);
        this.blockCopyStatement = copyStatement(schema, "blocks", BlockRecord.COLUMNS);
    }

    public static PostgresBankingStageStore connect(BankingStageProperties.Storage storage) {
        if (storage.getUrl() == null || storage.getUrl().isBlank()) {
            throw new IllegalArgumentException("banking-stage.storage.url is required when storage is enabled");
        }
        Properties info = new Properties();
        if (storage.getUser() != null) {
            info.setProperty("user", storage.getUser());
        }
        if (storage.getPassword() != null) {
            info.setProperty("password", storage.getPassword());
        }
        try {
            logger.info("Connecting to Postgres");
            Connection connection = DriverManager.getConnection(storage.getUrl(), info);
            connection.setAutoCommit(true);
            return new PostgresBankingStageStore(connection, storage.getSchema());
        } catch (SQLException ex) {
            throw new StorageConnectionLostException("Connecting to Postgres failed: " + ex.getMessage(), ex);
        }
    }

    static String copyStatement(String schema, String table, List<String> columns) {
        return "COPY " + schema + "." + table + "(" + String.join(", ", columns) + ") FROM STDIN WITH (FORMAT csv)";
    }

    @Override
    public void saveTransactionInfos(List<TransactionInfo> transactionInfos) {
        if (transactionInfos.isEmpty()) {
            return;
        }
        StringBuilder rows = new StringBuilder();
        for (TransactionInfo info : transactionInfos) {
            CsvRows.appendRow(rows, TransactionRecord.from(info, mapper).values());
        }
        long copied = copy(transactionCopyStatement, rows.toString());
        logger.debug("Saved {} transaction infos", copied);
    }

    @Override
    public void saveBlock(BlockInfo blockInfo) {
        StringBuilder row = new StringBuilder();
        CsvRows.appendRow(row, BlockRecord.from(blockInfo, mapper).values());
        copy(blockCopyStatement, row.toString());
        logger.debug("Saved block {}", blockInfo.getSlot());
    }

    private synchronized long copy(String statement, String rows) {
        try {
            return copyManager.copyIn(statement, new StringReader(rows));
        } catch (SQLException ex) {
            throw translate(ex);
        } catch (IOException ex) {
            throw new StorageConnectionLostException("Connection to Postgres broke: " + ex.getMessage(), ex);
        }
    }

    private StorageException translate(SQLException ex) {
        String state = ex.getSQLState();
        boolean connectionGone;
        try {
            connectionGone = connection.isClosed() || (state != null && state.startsWith("08"));
        } catch (SQLException closedCheckFailure) {
            connectionGone = true;
        }
        if (connectionGone) {
            return new StorageConnectionLostException("Connection to Postgres broke: " + ex.getMessage(), ex);
        }
        return new StorageException("COPY failed (" + state + "): " + ex.getMessage(), ex);
    }

    @Override
    public synchronized void close() {
        try {
            connection.close();
        } catch (SQLException ex) {
            logger.warn("Failed to close Postgres connection: {}", ex.getMessage());
        }
    }
}
