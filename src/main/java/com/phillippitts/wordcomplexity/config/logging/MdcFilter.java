package com.phillippitts.wordcomplexity.config.logging;

import com.phillippitts.wordcomplexity.util.LogSanitizer;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Adds request-scoped values to Log4j2's MDC (ThreadContext) for structured logging.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID header, or generated UUID</li>
 *   <li>word: the word being looked up on {@code /api/words/{word}}</li>
 * </ul>
 *
 * <p>The context is always cleared after the request to avoid leakage across threads.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String WORDS_PATH = "/api/words/";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = http.getHeader(REQUEST_ID_HEADER);
                ThreadContext.put("requestId", requestId == null || requestId.isBlank()
                        ? UUID.randomUUID().toString()
                        : LogSanitizer.truncate(requestId, 64));

                String word = wordFromPath(http.getRequestURI());
                if (word != null) {
                    ThreadContext.put("word", word);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    static String wordFromPath(String uri) {
        if (uri == null || !uri.startsWith(WORDS_PATH) || uri.length() == WORDS_PATH.length()) {
            return null;
        }
        String raw = uri.substring(WORDS_PATH.length());
        return LogSanitizer.truncate(URLDecoder.decode(raw, StandardCharsets.UTF_8), 40);
    }
}
