package io.sharedkey.platform.domain.error;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ProblemTypes
 *
 * <p>Registry of RFC7807 <em>problem type</em> URIs emitted by the SharedKey authentication
 * pipeline. Each type carries a stable URI, a short title and the HTTP status it defaults to.</p>
 *
 * <h2>Principles</h2>
 * <ul>
 *   <li><b>Stable URIs:</b> {@code https://problems.sharedkey.io/{slug}} with lowercase, kebab-case slugs.</li>
 *   <li><b>No enumeration hints:</b> unknown accounts and bad signatures share
 *       {@link #AUTHENTICATION_FAILED}; no separate type exists for unknown accounts.</li>
 *   <li><b>Framework-agnostic:</b> pure JDK; no Spring or servlet dependencies here.</li>
 *   <li><b>Caller vs. collaborator:</b> 4xx types describe the caller's request, 5xx types a
 *       broken host-supplied collaborator.</li>
 * </ul>
 */
public final class ProblemTypes {

    /** Base authority for all problem type URIs. Keep stable across versions. */
    public static final String BASE = "https://problems.sharedkey.io";

    private static final Map<String, ProblemType> REGISTRY;

    // -------------------------------------------------------------------------------------
    // Caller-side rejections
    // -------------------------------------------------------------------------------------

    /** 401 – Credential malformed, account unknown or signature mismatch. */
    public static final ProblemType AUTHENTICATION_FAILED =
            def("authentication-failed", "Authentication Failed", 401);

    /** 403 – Request timestamp outside the accepted replay window. */
    public static final ProblemType REQUEST_EXPIRED =
            def("request-expired", "Request Expired", 403);

    /** 412 – A header the signing scheme requires is missing or unreadable. */
    public static final ProblemType PRECONDITION_FAILED =
            def("precondition-failed", "Precondition Failed", 412);

    // -------------------------------------------------------------------------------------
    // Collaborator failures
    // -------------------------------------------------------------------------------------

    /** 500 – The configured identity transformer failed. */
    public static final ProblemType IDENTITY_TRANSFORMATION_FAILED =
            def("identity-transformation-failed", "Identity Transformation Failed", 500);

    /** 503 – The secret resolver could not complete the lookup. */
    public static final ProblemType SECRET_RESOLUTION_FAILED =
            def("secret-resolution-failed", "Secret Resolution Failed", 503);

    // -------------------------------------------------------------------------------------
    // Static registry & helpers
    // -------------------------------------------------------------------------------------

    static {
        Map<String, ProblemType> map = new LinkedHashMap<>();
        for (ProblemType t : new ProblemType[] {
                AUTHENTICATION_FAILED, REQUEST_EXPIRED, PRECONDITION_FAILED,
                IDENTITY_TRANSFORMATION_FAILED, SECRET_RESOLUTION_FAILED
        }) {
            map.put(t.slug(), t);
        }
        REGISTRY = Collections.unmodifiableMap(map);
    }

    private ProblemTypes() {
        /* no instances */
    }

    /**
     * Create a {@link ProblemType} for a custom slug without registering it globally.
     * Intended for host-specific stages that add their own rejections to the pipeline.
     */
    public static ProblemType custom(String slug, String title, int defaultStatus) {
        return create(slug, title, defaultStatus);
    }

    /** Resolve a registered type by slug (e.g., "request-expired"). */
    public static Optional<ProblemType> bySlug(String slug) {
        if (slug == null) return Optional.empty();
        return Optional.ofNullable(REGISTRY.get(slug));
    }

    /** @return an unmodifiable view of the registered types keyed by slug. */
    public static Map<String, ProblemType> registry() {
        return REGISTRY;
    }

    /** Compose the canonical type URI for a given valid slug. */
    public static URI typeUri(String slug) {
        return URI.create(BASE + "/" + validateSlug(slug));
    }

    private static ProblemType def(String slug, String title, int status) {
        return create(slug, title, status);
    }

    private static ProblemType create(String slug, String title, int status) {
        String s = validateSlug(slug);
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        if (status < 100 || status > 599) {
            throw new IllegalArgumentException("defaultStatus must be a valid HTTP status code");
        }
        return new ProblemType(s, typeUri(s), title.trim(), status);
    }

    private static String validateSlug(String slug) {
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("slug must not be blank");
        }
        String s = slug.trim();
        if (!s.matches("[a-z0-9]+(?:-[a-z0-9]+)*")) {
            throw new IllegalArgumentException("slug must be lower-kebab-case [a-z0-9-], got: " + slug);
        }
        if (s.length() > 80) {
            throw new IllegalArgumentException("slug too long (max 80 chars)");
        }
        return s;
    }

    /**
     * Immutable descriptor of a problem type.
     *
     * @param slug           lower-kebab-case short code (e.g., {@code request-expired})
     * @param uri            stable absolute URI under {@link #BASE}
     * @param title          short, human-readable title
     * @param defaultStatus  suggested HTTP status code
     */
    public record ProblemType(String slug, URI uri, String title, int defaultStatus) {
        public ProblemType {
            Objects.requireNonNull(slug, "slug");
            Objects.requireNonNull(uri, "uri");
            Objects.requireNonNull(title, "title");
        }

        @Override
        public String toString() {
            return slug + " (" + defaultStatus + " -> " + uri + ")";
        }
    }
}
