package com.cfoPilot.aiCfo.gateway.util;

/**
 * Utility class for masking organization and user IDs in logs.
 */
public class IdMasker {

    private IdMasker() {}

    /**
     * Shows first 2 and last 2 characters, masks the middle.
     *
     * @param id The identifier to mask
     * @return Masked identifier (e.g., "3f****9c")
     */
    public static String mask(String id) {
        if (id == null || id.length() <= 4) {
            return "****";
        }
        return id.substring(0, 2) + "****" + id.substring(id.length() - 2);
    }
}
