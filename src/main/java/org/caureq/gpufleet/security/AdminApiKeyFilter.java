package org.caureq.gpufleet.security;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.config.AppProps;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/** Guards {@code /api/admin/*}: admin key header plus client IP allowlist. */
@Component
@Slf4j
public class AdminApiKeyFilter implements Filter {
    public static final String HEADER = "X-ADMIN-API-KEY";

    private final String adminKey;
    private final List<String> cidrs;

    public AdminApiKeyFilter(AppProps props) {
        this.adminKey = props.admin().apiKey() == null ? "" : props.admin().apiKey();
        var raw = props.admin().allowIps() == null ? "127.0.0.1" : props.admin().allowIps();
        this.cidrs = List.of(raw.trim().split("\\s*,\\s*"));
        if (adminKey.isBlank()) {
            log.warn("[Admin] app.admin.api-key is not set, admin API will refuse every call");
        }
    }

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        var r = (HttpServletRequest) req;
        var w = (HttpServletResponse) res;

        String k = r.getHeader(HEADER);
        if (adminKey.isBlank() || k == null || !constantTimeEquals(k, adminKey)) {
            w.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Missing/invalid admin key");
            return;
        }

        String ip = r.getRemoteAddr();
        if ("0:0:0:0:0:0:0:1".equals(ip) || "::1".equals(ip)) ip = "127.0.0.1";

        if (!isAllowed(ip)) {
            log.warn("[Admin] {} {} refused for {}", r.getMethod(), r.getRequestURI(), ip);
            w.sendError(HttpServletResponse.SC_FORBIDDEN, "IP not allowed: " + ip);
            return;
        }

        chain.doFilter(req, res);
    }

    boolean isAllowed(String ip) {
        for (var rule : cidrs) {
            if (rule.equals("*")) return true;
            if (!rule.contains("/")) {
                if (rule.equals(ip)) return true;
            } else {
                if (matchesCidr(ip, rule)) return true;
            }
        }
        return false;
    }

    // IPv4 only
    static boolean matchesCidr(String ip, String cidr) {
        String[] parts = cidr.split("/");
        if (parts.length != 2) return false;
        try {
            int prefix = Integer.parseInt(parts[1]);
            if (prefix < 0 || prefix > 32) return false;
            byte[] addr = InetAddress.getByName(ip).getAddress();
            byte[] net = InetAddress.getByName(parts[0]).getAddress();
            if (addr.length != 4 || net.length != 4) return false;

            int mask = prefix == 0 ? 0 : 0xffffffff << (32 - prefix);
            return (toInt(addr) & mask) == (toInt(net) & mask);
        } catch (NumberFormatException | UnknownHostException e) {
            log.debug("[Admin] unusable allowlist rule {}: {}", cidr, e.getMessage());
            return false;
        }
    }

    private static int toInt(byte[] b) {
        return ((b[0] & 0xff) << 24) | ((b[1] & 0xff) << 16) | ((b[2] & 0xff) << 8) | (b[3] & 0xff);
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}
