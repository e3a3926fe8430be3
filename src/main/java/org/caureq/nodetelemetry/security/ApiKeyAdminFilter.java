package org.caureq.nodetelemetry.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.caureq.nodetelemetry.api.error.ApiError;
import org.caureq.nodetelemetry.api.error.ErrorCode;
import org.springframework.core.env.Environment;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * Guards /api/admin/**: requires X-ADMIN-API-KEY and a client IP in admin.allow-ips
 * (exact IPv4, IPv4 CIDR, or "*").
 */
@Component
public class ApiKeyAdminFilter implements Filter {
    static final String HEADER = "X-ADMIN-API-KEY";
    static final String PROTECTED_PREFIX = "/api/admin/";

    private final String adminKey;
    private final List<String> cidrs;
    private final ObjectMapper om;

    public ApiKeyAdminFilter(Environment env, ObjectMapper om) {
        this.adminKey = env.getProperty("admin.api-key", "ADMIN-CHANGE-ME");
        var raw = env.getProperty("admin.allow-ips", "127.0.0.1");
        this.cidrs = List.of(raw.split("\\s*,\\s*"));
        this.om = om;
    }

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        var r = (HttpServletRequest) req;
        var w = (HttpServletResponse) res;

        if (!r.getRequestURI().startsWith(PROTECTED_PREFIX)) { chain.doFilter(req, res); return; }

        String k = r.getHeader(HEADER);
        if (k == null || !k.equals(adminKey)) {
            reject(r, w, HttpServletResponse.SC_UNAUTHORIZED, ErrorCode.AUTH_REQUIRED, "Missing/invalid admin key");
            return;
        }

        String ip = r.getRemoteAddr();
        if ("0:0:0:0:0:0:0:1".equals(ip) || "::1".equals(ip)) ip = "127.0.0.1";
        if (!isAllowed(ip)) {
            reject(r, w, HttpServletResponse.SC_FORBIDDEN, ErrorCode.FORBIDDEN, "IP not allowed: " + ip);
            return;
        }

        chain.doFilter(req, res);
    }

    private void reject(HttpServletRequest r, HttpServletResponse w, int status, ErrorCode code, String msg)
            throws IOException {
        w.setStatus(status);
        w.setContentType(MediaType.APPLICATION_JSON_VALUE);
        om.writeValue(w.getWriter(), ApiError.of(code, msg, r.getHeader("X-Correlation-Id")));
    }

    boolean isAllowed(String ip) {
        for (var rule : cidrs) {
            if (rule.equals("*")) return true;
            if (!rule.contains("/")) {
                if (rule.equals(ip)) return true;
            } else if (matchesCidr(ip, rule)) {
                return true;
            }
        }
        return false;
    }

    // IPv4 only
    private static boolean matchesCidr(String ip, String cidr) {
        try {
            String[] parts = cidr.split("/");
            int prefix = Integer.parseInt(parts[1]);
            byte[] addr = InetAddress.getByName(ip).getAddress();
            byte[] net  = InetAddress.getByName(parts[0]).getAddress();
            if (addr.length != 4 || net.length != 4) return false;

            int mask = prefix == 0 ? 0 : 0xffffffff << (32 - prefix);
            return (toInt(addr) & mask) == (toInt(net) & mask);
        } catch (UnknownHostException | NumberFormatException | ArrayIndexOutOfBoundsException e) {
            return false;
        }
    }

    private static int toInt(byte[] b) {
        return ((b[0] & 0xff) << 24) | ((b[1] & 0xff) << 16) | ((b[2] & 0xff) << 8) | (b[3] & 0xff);
    }
}
