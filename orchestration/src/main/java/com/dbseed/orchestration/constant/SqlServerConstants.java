package com.dbseed.orchestration.constant;

public class SqlServerConstants {

    // Cannot drop database because it is currently in use.
    public static final int DATABASE_IN_USE_ERROR_NUMBER = 3702;

    public static final String DATABASE_EXISTS_QUERY = "SELECT COUNT(*) FROM sys.databases WHERE name = ?";

    public static final String FILE_LIST_TYPE_LOG = "L";

    // RESTORE FILELISTONLY result set columns
    public static final String FILE_LIST_LOGICAL_NAME_COLUMN = "LogicalName";
    public static final String FILE_LIST_TYPE_COLUMN = "Type";

    private SqlServerConstants() {
    }
}
