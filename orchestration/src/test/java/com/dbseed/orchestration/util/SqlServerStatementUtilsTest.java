package com.dbseed.orchestration.util;

import com.dbseed.orchestration.model.BackupManifestEntry;
import com.dbseed.orchestration.model.SqlIdentifier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqlServerStatementUtilsTest {

    private static final SqlIdentifier DATABASE = SqlIdentifier.of("sales");

    @Test
    void shouldRelocateEveryManifestEntryByOrdinal() {
        List<BackupManifestEntry> manifest = List.of(
                new BackupManifestEntry("Sales_Data", BackupManifestEntry.StreamKind.DATA),
                new BackupManifestEntry("Sales_Log", BackupManifestEntry.StreamKind.LOG),
                new BackupManifestEntry("Sales_Archive", BackupManifestEntry.StreamKind.DATA)
        );

        String statement = SqlServerStatementUtils.createRestoreStatement(DATABASE, "/var/opt/mssql/backup/sales.bak", "/var/opt/mssql/data", manifest);

        assertEquals(
                "RESTORE DATABASE [sales]\n"
                        + "FROM DISK = '/var/opt/mssql/backup/sales.bak'\n"
                        + "WITH MOVE 'Sales_Data' TO '/var/opt/mssql/data/sales_0.mdf',\n"
                        + "     MOVE 'Sales_Log' TO '/var/opt/mssql/data/sales_1_log.ldf',\n"
                        + "     MOVE 'Sales_Archive' TO '/var/opt/mssql/data/sales_2.mdf',\n"
                        + "     REPLACE, RECOVERY",
                statement
        );
    }

    @Test
    void shouldEscapeQuotesInLogicalNames() {
        List<BackupManifestEntry> manifest = List.of(new BackupManifestEntry("O'Brien", BackupManifestEntry.StreamKind.DATA));

        String statement = SqlServerStatementUtils.createRestoreStatement(DATABASE, "/backup/sales.bak", "/data", manifest);

        assertTrue(statement.contains("MOVE 'O''Brien' TO '/data/sales_0.mdf'"));
    }

    @Test
    void shouldCreatePhysicalFileNames() {
        assertEquals("sales_0.mdf", SqlServerStatementUtils.createPhysicalFileName(DATABASE, 0, BackupManifestEntry.StreamKind.DATA));
        assertEquals("sales_1_log.ldf", SqlServerStatementUtils.createPhysicalFileName(DATABASE, 1, BackupManifestEntry.StreamKind.LOG));
    }

    @Test
    void shouldSwitchToSingleUserBeforeDrop() {
        assertEquals(
                "ALTER DATABASE [sales] SET SINGLE_USER WITH ROLLBACK IMMEDIATE;\nDROP DATABASE [sales];",
                SqlServerStatementUtils.createSingleUserAndDropStatement(DATABASE)
        );
    }

    @Test
    void shouldKillOtherSessionsAndRestoreMultiUser() {
        String statement = SqlServerStatementUtils.createKillSessionsAndSetMultiUserStatement(DATABASE);

        assertTrue(statement.contains("DB_ID('sales')"));
        assertTrue(statement.contains("session_id <> @@SPID"));
        assertTrue(statement.endsWith("ALTER DATABASE [sales] SET MULTI_USER WITH ROLLBACK IMMEDIATE;"));
    }

    @Test
    void shouldCreateFinalizationStatements() {
        assertEquals("ALTER DATABASE [sales] SET TRUSTWORTHY ON;", SqlServerStatementUtils.createSetTrustworthyStatement(DATABASE));
        assertEquals("EXEC sp_changedbowner 'sa';", SqlServerStatementUtils.createChangeOwnerStatement("sa"));
    }

    @Test
    void shouldCountOnlyUserTables() {
        assertEquals("SELECT COUNT(*) FROM [sales].sys.tables WHERE is_ms_shipped = 0", SqlServerStatementUtils.createCountUserTablesQuery(DATABASE));
    }
}
