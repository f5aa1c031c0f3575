package com.mlab.telescope.service;

import com.mlab.telescope.exception.SiteResolutionException;
import org.junit.jupiter.api.Test;

import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DnsSiteResolverTest {

    private static final Map<String, String> DNS = Map.of(
            "ndt.iupui.mlab1.lga02.measurement-lab.org", "38.106.70.147",
            "ndt.iupui.mlab2.lga02.measurement-lab.org", "38.106.70.160",
            "ndt.iupui.mlab3.lga02.measurement-lab.org", "38.106.70.173");

    private final List<String> lookups = new ArrayList<>();

    private final DnsSiteResolver resolver = new DnsSiteResolver(hostname -> {
        lookups.add(hostname);
        String address = DNS.get(hostname);
        if (address == null) {
            throw new UnknownHostException(hostname);
        }
        return address;
    });

    @Test
    void resolvesEveryNodeOfTheSite() {
        assertThat(resolver.resolve("lga02")).containsExactly("38.106.70.147", "38.106.70.160", "38.106.70.173");
    }

    @Test
    void cachesAnswers() {
        resolver.resolve("lga02");
        resolver.resolve("lga02");

        assertThat(lookups).hasSize(3);
    }

    @Test
    void unknownSite() {
        assertThatThrownBy(() -> resolver.resolve("xyz01"))
                .isInstanceOf(SiteResolutionException.class)
                .hasMessageContaining("ndt.iupui.mlab1.xyz01.measurement-lab.org");
    }
}
