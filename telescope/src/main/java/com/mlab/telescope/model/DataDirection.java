package com.mlab.telescope.model;

/**
 * Direction of an NDT transfer as recorded in connection_spec.data_direction.
 */
public enum DataDirection {
    CLIENT_TO_SERVER(0),
    SERVER_TO_CLIENT(1);

    private final int code;

    DataDirection(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
