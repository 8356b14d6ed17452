package com.dbseed.orchestration.util;

import com.dbseed.orchestration.model.BackupManifestEntry;
import com.dbseed.orchestration.model.SqlIdentifier;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Builds statement texts. Identifiers are {@link SqlIdentifier}s, other values are escaped as string literals.
 */
public class SqlServerStatementUtils {

    public static String createKillSessionsAndSetMultiUserStatement(SqlIdentifier databaseName) {
        return "DECLARE @kill varchar(8000) = '';\n"
                + "SELECT @kill = @kill + 'KILL ' + CONVERT(varchar(5), session_id) + ';'\n"
                + "FROM sys.dm_exec_sessions\n"
                + "WHERE database_id = DB_ID(" + JdbcUtils.toStringLiteral(databaseName.getValue()) + ")\n"
                + "AND session_id <> @@SPID;\n"
                + "EXEC(@kill);\n"
                + "ALTER DATABASE " + databaseName.quoted() + " SET MULTI_USER WITH ROLLBACK IMMEDIATE;";
    }

    public static String createCountUserTablesQuery(SqlIdentifier databaseName) {
        return "SELECT COUNT(*) FROM " + databaseName.quoted() + ".sys.tables WHERE is_ms_shipped = 0";
    }

    public static String createSingleUserAndDropStatement(SqlIdentifier databaseName) {
        return "ALTER DATABASE " + databaseName.quoted() + " SET SINGLE_USER WITH ROLLBACK IMMEDIATE;\n"
                + "DROP DATABASE " + databaseName.quoted() + ";";
    }

    public static String createFileListQuery(String engineBackupFilePath) {
        return "RESTORE FILELISTONLY FROM DISK = " + JdbcUtils.toStringLiteral(engineBackupFilePath);
    }

    /**
     * Physical file name is {@code <database>_<ordinal><suffix>}, ordinal follows manifest order.
     */
    public static String createPhysicalFileName(SqlIdentifier databaseName, int ordinal, BackupManifestEntry.StreamKind streamKind) {
        return databaseName.getValue() + "_" + ordinal + streamKind.getPhysicalFileSuffix();
    }

    /**
     * Single statement relocating every file of the manifest, so the engine restores all of them atomically.
     */
    public static String createRestoreStatement(SqlIdentifier databaseName, String engineBackupFilePath, String engineDataDirectory, List<BackupManifestEntry> manifest) {
        String moveClauses = IntStream.range(0, manifest.size())
                .mapToObj(index -> {
                    BackupManifestEntry entry = manifest.get(index);
                    String physicalPath = engineDataDirectory + "/" + createPhysicalFileName(databaseName, index, entry.getStreamKind());
                    return "MOVE " + JdbcUtils.toStringLiteral(entry.getLogicalName()) + " TO " + JdbcUtils.toStringLiteral(physicalPath);
                })
                .collect(Collectors.joining(",\n     "));

        return "RESTORE DATABASE " + databaseName.quoted() + "\n"
                + "FROM DISK = " + JdbcUtils.toStringLiteral(engineBackupFilePath) + "\n"
                + "WITH " + moveClauses + ",\n"
                + "     REPLACE, RECOVERY";
    }

    public static String createSetTrustworthyStatement(SqlIdentifier databaseName) {
        return "ALTER DATABASE " + databaseName.quoted() + " SET TRUSTWORTHY ON;";
    }

    public static String createChangeOwnerStatement(String ownerPrincipal) {
        return "EXEC sp_changedbowner " + JdbcUtils.toStringLiteral(ownerPrincipal) + ";";
    }

    private SqlServerStatementUtils() {
    }
}
