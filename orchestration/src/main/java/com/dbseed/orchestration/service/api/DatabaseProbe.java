package com.dbseed.orchestration.service.api;

import com.dbseed.orchestration.model.DatabaseClassification;
import com.dbseed.orchestration.model.RestoreTarget;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Inspects database engine to find out in which state target database is.
 * <p>
 * Probing of an existing database terminates all other sessions connected to it. Use only for databases exclusively owned by this application.
 */
public interface DatabaseProbe {

    /**
     * Classifies target database. If database is registered in the catalog, other sessions are forcibly reclaimed first.
     *
     * @param administrativeConnection connection to the administrative catalog
     * @param target                   database to classify
     * @param listener                 notified about probing steps
     * @return classification with user tables count
     * @throws SQLException if catalog query failed
     */
    DatabaseClassification classify(Connection administrativeConnection, RestoreTarget target, ProbeListener listener) throws SQLException;

    default DatabaseClassification classify(Connection administrativeConnection, RestoreTarget target) throws SQLException {
        return classify(administrativeConnection, target, ProbeListener.NONE);
    }

    /**
     * Terminates other sessions of the database and switches it to multi-user mode rolling back in-flight transactions.
     * Best-effort, failure is logged.
     *
     * @return true if succeeded
     */
    boolean reclaim(Connection administrativeConnection, RestoreTarget target);

    interface ProbeListener {
        ProbeListener NONE = new ProbeListener() {
        };

        default void onReclaimStarted() {
        }

        default void onReclaimFinished(boolean succeeded) {
        }
    }
}
