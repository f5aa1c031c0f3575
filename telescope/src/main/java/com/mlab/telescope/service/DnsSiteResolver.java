package com.mlab.telescope.service;

import com.mlab.telescope.exception.SiteResolutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the NDT slice on each of a site's three nodes through DNS,
 * e.g. ndt.iupui.mlab1.lga02.measurement-lab.org. Answers are cached per
 * hostname for the life of the process.
 */
@Service
@Slf4j
public class DnsSiteResolver implements SiteResolver {

    private static final List<String> NODES = List.of("mlab1", "mlab2", "mlab3");
    private static final String HOSTNAME_FORMAT = "ndt.iupui.%s.%s.measurement-lab.org";

    private final HostLookup hostLookup;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public DnsSiteResolver() {
        this(hostname -> InetAddress.getByName(hostname).getHostAddress());
    }

    DnsSiteResolver(HostLookup hostLookup) {
        this.hostLookup = hostLookup;
    }

    @Override
    public List<String> resolve(String siteId) {
        List<String> addresses = new ArrayList<>();
        for (String node : NODES) {
            String address = resolveHostname(String.format(HOSTNAME_FORMAT, node, siteId));
            log.debug("Found IP for {} of {}.", siteId, address);
            addresses.add(address);
        }
        return addresses;
    }

    private String resolveHostname(String hostname) {
        String cached = cache.get(hostname);
        if (cached != null) {
            return cached;
        }
        try {
            String address = hostLookup.lookup(hostname);
            cache.put(hostname, address);
            return address;
        } catch (UnknownHostException e) {
            throw new SiteResolutionException(hostname, e);
        }
    }

    @FunctionalInterface
    interface HostLookup {
        String lookup(String hostname) throws UnknownHostException;
    }
}
