package org.caureq.gpufleet.security;

import org.caureq.gpufleet.config.AppProps;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;

class AdminApiKeyFilterTest {

    private static AdminApiKeyFilter filter(String key, String allow) {
        return new AdminApiKeyFilter(new AppProps(new AppProps.AdminProps(key, allow), null, null, null, null));
    }

    private static MockHttpServletRequest request(String key, String ip) {
        var req = new MockHttpServletRequest("GET", "/api/admin/instances");
        if (key != null) req.addHeader(AdminApiKeyFilter.HEADER, key);
        req.setRemoteAddr(ip);
        return req;
    }

    @Test
    void validKeyFromAllowedIpPasses() throws Exception {
        var res = new MockHttpServletResponse();
        var chain = new MockFilterChain();

        filter("s3cret", "127.0.0.1").doFilter(request("s3cret", "127.0.0.1"), res, chain);

        assertEquals(200, res.getStatus());
        assertNotNull(chain.getRequest());
    }

    @Test
    void wrongOrMissingKeyIsUnauthorized() throws Exception {
        var f = filter("s3cret", "*");

        var wrong = new MockHttpServletResponse();
        f.doFilter(request("nope", "127.0.0.1"), wrong, new MockFilterChain());
        var missing = new MockHttpServletResponse();
        f.doFilter(request(null, "127.0.0.1"), missing, new MockFilterChain());

        assertEquals(401, wrong.getStatus());
        assertEquals(401, missing.getStatus());
    }

    @Test
    void unconfiguredKeyRefusesEverything() throws Exception {
        var res = new MockHttpServletResponse();
        var chain = new MockFilterChain();

        filter("", "*").doFilter(request("", "127.0.0.1"), res, chain);

        assertEquals(401, res.getStatus());
        assertNull(chain.getRequest());
    }

    @Test
    void ipOutsideAllowlistIsForbidden() throws Exception {
        var res = new MockHttpServletResponse();

        filter("s3cret", "10.0.0.0/8").doFilter(request("s3cret", "192.168.1.4"), res, new MockFilterChain());

        assertEquals(403, res.getStatus());
    }

    @Test
    void ipv6LoopbackCountsAsLocalhost() throws Exception {
        var res = new MockHttpServletResponse();
        var chain = new MockFilterChain();

        filter("s3cret", "127.0.0.1").doFilter(request("s3cret", "0:0:0:0:0:0:0:1"), res, chain);

        assertNotNull(chain.getRequest());
    }

    @Test
    void cidrMatching() {
        assertTrue(AdminApiKeyFilter.matchesCidr("10.1.2.3", "10.0.0.0/8"));
        assertTrue(AdminApiKeyFilter.matchesCidr("192.168.1.200", "192.168.1.128/25"));
        assertFalse(AdminApiKeyFilter.matchesCidr("192.168.1.100", "192.168.1.128/25"));
        assertTrue(AdminApiKeyFilter.matchesCidr("8.8.8.8", "0.0.0.0/0"));
        assertFalse(AdminApiKeyFilter.matchesCidr("10.1.2.3", "10.0.0.0/40"));
        assertFalse(AdminApiKeyFilter.matchesCidr("10.1.2.3", "10.0.0.0/x"));
    }

    @Test
    void allowlistMixesExactAndCidrRules() {
        var f = filter("k", "127.0.0.1, 10.0.0.0/8");

        assertTrue(f.isAllowed("127.0.0.1"));
        assertTrue(f.isAllowed("10.20.30.40"));
        assertFalse(f.isAllowed("11.0.0.1"));
    }
}
