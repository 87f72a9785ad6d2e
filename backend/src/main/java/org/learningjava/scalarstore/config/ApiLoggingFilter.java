package org.learningjava.scalarstore.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One access line per API call, tagged with the scalars operation and project it touched.
 * Server errors are logged at WARN.
 */
@Component
public class ApiLoggingFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(ApiLoggingFilter.class);

    // /api/scalars/<op>/<project>[/<experiment>] and /api/projects[/exists]/<project>[/experiments]
    private static final Pattern SCALARS = Pattern.compile("^/api/scalars/([^/]+)/([^/]+)(?:/([^/]+))?/?$");
    private static final Pattern PROJECTS = Pattern.compile("^/api/projects(?:/exists)?(?:/([^/]+))?(?:/experiments)?/?$");

    @Override
    protected boolean shouldNotFilter(HttpServletRequest req) {
        return !req.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        long t0 = System.currentTimeMillis();
        try {
            chain.doFilter(req, res);
        } finally {
            long ms = System.currentTimeMillis() - t0;
            String target = describe(req.getRequestURI());
            int status = res.getStatus();
            if (status >= 500) {
                log.warn("[API] {} {} -> {} ({}ms)", req.getMethod(), target, status, ms);
            } else {
                log.info("[API] {} {} -> {} ({}ms)", req.getMethod(), target, status, ms);
            }
        }
    }

    /** {@code op=<op> project=<id> [experiment=<id>]} for known routes, the raw path otherwise. */
    static String describe(String uri) {
        Matcher m = SCALARS.matcher(uri);
        if (m.matches()) {
            String s = "op=" + m.group(1) + " project=" + m.group(2);
            return m.group(3) == null ? s : s + " experiment=" + m.group(3);
        }
        m = PROJECTS.matcher(uri);
        if (m.matches()) {
            return m.group(1) == null ? "op=projects" : "op=projects project=" + m.group(1);
        }
        return uri;
    }
}
