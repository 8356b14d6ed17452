package com.dbseed.quarkusroot.validator;

public interface ConfigurationValidator {
    /**
     * Validates part of the configuration and logs every problem found.
     *
     * @return true if configuration is valid
     */
    boolean validate();
}
