package com.mlab.telescope.model;

/**
 * Credentials for talking to the warehouse on behalf of one project.
 */
public record WarehouseSession(String projectId, String accessToken) {

    @Override
    public String toString() {
        return "WarehouseSession[projectId=" + projectId + "]";
    }
}
