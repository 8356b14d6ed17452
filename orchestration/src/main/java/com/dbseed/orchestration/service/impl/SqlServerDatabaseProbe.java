package com.dbseed.orchestration.service.impl;

import com.dbseed.orchestration.constant.SqlServerConstants;
import com.dbseed.orchestration.model.DatabaseClassification;
import com.dbseed.orchestration.model.DatabaseState;
import com.dbseed.orchestration.model.RestoreTarget;
import com.dbseed.orchestration.service.api.DatabaseProbe;
import com.dbseed.orchestration.util.SqlServerStatementUtils;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

@Slf4j
@ApplicationScoped
public class SqlServerDatabaseProbe implements DatabaseProbe {

    @Override
    public DatabaseClassification classify(Connection administrativeConnection, RestoreTarget target, ProbeListener listener) throws SQLException {
        if (!isRegistered(administrativeConnection, target)) {
            log.info("Database {} does not exist.", target.getDatabaseName());
            return new DatabaseClassification(DatabaseState.ABSENT, 0);
        }

        listener.onReclaimStarted();
        boolean reclaimed = reclaim(administrativeConnection, target);
        listener.onReclaimFinished(reclaimed);

        int tableCount = countUserTables(administrativeConnection, target);
        DatabaseState state = tableCount == 0 ? DatabaseState.PRESENT_EMPTY : DatabaseState.PRESENT_POPULATED;

        return new DatabaseClassification(state, tableCount);
    }

    @Override
    public boolean reclaim(Connection administrativeConnection, RestoreTarget target) {
        try (Statement statement = administrativeConnection.createStatement()) {
            statement.execute(SqlServerStatementUtils.createKillSessionsAndSetMultiUserStatement(target.getDatabaseName()));
            log.info("Killed connections and set database {} to multi-user mode", target.getDatabaseName());
            return true;
        } catch (SQLException e) {
            log.warn("Could not reset database {} to multi-user mode", target.getDatabaseName(), e);
            return false;
        }
    }

    private boolean isRegistered(Connection administrativeConnection, RestoreTarget target) throws SQLException {
        try (PreparedStatement statement = administrativeConnection.prepareStatement(SqlServerConstants.DATABASE_EXISTS_QUERY)) {
            statement.setString(1, target.getDatabaseName().getValue());
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() && resultSet.getInt(1) > 0;
            }
        }
    }

    private int countUserTables(Connection administrativeConnection, RestoreTarget target) throws SQLException {
        try (Statement statement = administrativeConnection.createStatement();
             ResultSet resultSet = statement.executeQuery(SqlServerStatementUtils.createCountUserTablesQuery(target.getDatabaseName()))) {
            return resultSet.next() ? resultSet.getInt(1) : 0;
        }
    }
}
