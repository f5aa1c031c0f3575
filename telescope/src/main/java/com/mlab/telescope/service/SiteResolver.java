package com.mlab.telescope.service;

import java.util.List;

/**
 * Resolves an M-Lab site id to the addresses of its NDT servers.
 */
public interface SiteResolver {

    /**
     * @throws com.mlab.telescope.exception.SiteResolutionException when any server cannot be resolved
     */
    List<String> resolve(String siteId);
}
