package com.mlab.telescope.service;

import com.mlab.telescope.model.WarehouseSession;

/**
 * Supplies an authenticated warehouse session.
 */
public interface SessionProvider {

    /**
     * @throws com.mlab.telescope.exception.SessionUnavailableException when no session can be established
     */
    WarehouseSession getSession();
}
