package io.sharedkey.platform.http.filters;

import io.sharedkey.platform.domain.auth.Identity;
import io.sharedkey.platform.domain.request.RequestHeaders;
import io.sharedkey.platform.domain.request.SignedRequest;
import io.sharedkey.platform.http.error.ProblemHttpMapper;
import io.sharedkey.platform.http.pipeline.InboundRequest;
import io.sharedkey.platform.http.pipeline.RequestPipeline;
import io.sharedkey.platform.http.pipeline.StageResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * SharedKeyAuthFilter (Servlet)
 *
 * Servlet adapter for the {@link RequestPipeline}:
 * - Snapshots method, raw URI, raw query and headers into a {@link SignedRequest}.
 * - Runs the pipeline; the remaining filter chain is its terminal, so stages see the downstream
 *   status and any runtime exception the chain throws.
 * - On success exposes the {@link Identity} as a request attribute and as the servlet principal.
 * - On rejection writes status, headers and an application/problem+json body.
 * - A request abandoned during authentication ({@link CancellationException}) ends without a
 *   response body; the client is already gone.
 *
 * The bean is created by platform-starter-web (auto-config). No Spring stereotype here.
 */
public final class SharedKeyAuthFilter extends OncePerRequestFilter {

    private static final Logger LOG = LoggerFactory.getLogger(SharedKeyAuthFilter.class);

    public static final String REQUEST_ATTR_IDENTITY = SharedKeyAuthFilter.class.getName() + ".IDENTITY";

    private final RequestPipeline pipeline;
    private final ProblemHttpMapper problemMapper;
    private final List<String> publicPaths;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public SharedKeyAuthFilter(RequestPipeline pipeline, ProblemHttpMapper problemMapper, List<String> publicPaths) {
        this.pipeline      = Objects.requireNonNull(pipeline, "RequestPipeline");
        this.problemMapper = Objects.requireNonNull(problemMapper, "ProblemHttpMapper");
        this.publicPaths   = (publicPaths == null) ? List.of() : List.copyOf(publicPaths);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        // Skip CORS preflight
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())
                && request.getHeader("Access-Control-Request-Method") != null) {
            return true;
        }
        String path = pathWithinApplication(request);
        for (String pattern : publicPaths) {
            if (pathMatcher.match(pattern, path)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain chain
    ) throws ServletException, IOException {

        final SignedRequest signed = snapshot(request);
        final StageResponse result;
        try {
            result = pipeline.dispatch(
                    InboundRequest.of(signed),
                    inbound -> continueChain(inbound, request, response, chain));
        } catch (ChainFailure e) {
            e.rethrow();
            return;
        } catch (CancellationException e) {
            LOG.debug("Request {} {} abandoned during authentication", signed.method(), signed.rawPath());
            return;
        }

        if (result.isForwarded()) {
            return;
        }
        if (response.isCommitted()) {
            LOG.warn("Stage rejected {} {} with {} after the response was committed",
                    signed.method(), signed.rawPath(), result.status());
            return;
        }
        problemMapper.write(result, response);
    }

    /** Pipeline terminal: runs the rest of the filter chain and reports the status it produced. */
    private static StageResponse continueChain(
            InboundRequest inbound, HttpServletRequest request, HttpServletResponse response, FilterChain chain) {

        Optional<Identity> identity = inbound.identity();
        HttpServletRequest effectiveRequest = identity.isPresent()
                ? new IdentityRequestWrapper(request, identity.get())
                : request;
        identity.ifPresent(id -> effectiveRequest.setAttribute(REQUEST_ATTR_IDENTITY, id));
        try {
            chain.doFilter(effectiveRequest, response);
        } catch (IOException | ServletException | CancellationException e) {
            throw new ChainFailure(e);
        } finally {
            if (identity.isPresent()) {
                effectiveRequest.removeAttribute(REQUEST_ATTR_IDENTITY);
            }
        }
        return StageResponse.forwarded(inbound, response.getStatus());
    }

    /** Copies the parts of the servlet request that take part in signing; values stay undecoded. */
    static SignedRequest snapshot(HttpServletRequest request) {
        RequestHeaders.Builder headers = RequestHeaders.builder();
        for (String name : Collections.list(request.getHeaderNames())) {
            for (String value : Collections.list(request.getHeaders(name))) {
                headers.add(name, value);
            }
        }
        return new SignedRequest(
                request.getMethod(),
                rawPath(request),
                request.getQueryString(),
                headers.build());
    }

    private static String rawPath(HttpServletRequest req) {
        String p = req.getRequestURI();
        return (p == null || p.isEmpty()) ? "/" : p;
    }

    /**
     * Carries the chain's checked exceptions through {@link RequestPipeline#dispatch}, and keeps a
     * downstream {@link CancellationException} apart from one raised during authentication.
     */
    private static final class ChainFailure extends RuntimeException {
        private static final long serialVersionUID = 1L;

        ChainFailure(Exception cause) {
            super(cause);
        }

        void rethrow() throws IOException, ServletException {
            Throwable cause = getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof ServletException se) {
                throw se;
            }
            throw (RuntimeException) cause;
        }
    }

    private static String pathWithinApplication(HttpServletRequest req) {
        String uri = rawPath(req);
        String ctx = req.getContextPath();
        if (ctx != null && !ctx.isEmpty() && uri.startsWith(ctx)) {
            String rest = uri.substring(ctx.length());
            return rest.isEmpty() ? "/" : rest;
        }
        return uri;
    }
}
