package com.example.bulkfile.directory;

import java.util.List;

/**
 * Blocking access to the external identity service that knows group memberships.
 */
public interface DirectoryProvider {
    /**
     * Returns the member account names of a group; an unknown group has no members.
     */
    List<String> fetchGroup(String key) throws DirectoryUnavailableException;

    /**
     * Returns the domain name used to qualify member accounts.
     */
    String currentDomain() throws DirectoryUnavailableException;

    /**
     * Provider used when no directory is configured; every call fails so callers fall back.
     */
    static DirectoryProvider unavailable() {
        return new DirectoryProvider() {
            @Override
            public List<String> fetchGroup(String key) throws DirectoryUnavailableException {
                throw new DirectoryUnavailableException("No directory service configured");
            }

            @Override
            public String currentDomain() throws DirectoryUnavailableException {
                throw new DirectoryUnavailableException("No directory service configured");
            }
        };
    }
}
