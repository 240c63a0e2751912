package io.sharedkey.platform.starter.security.web.autoconfig;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Prefix: sharedkey.web.auth
 */
@Validated
@ConfigurationProperties(prefix = "sharedkey.web.auth")
public class SharedKeyWebProperties {

    /** Master switch handled by @ConditionalOnProperty on the auto-config. */
    private boolean enabled = false;

    /** Token preceding the credential in the Authorization header. */
    @NotBlank
    private String scheme = "SharedKey";

    /** Header carrying the RFC 1123 request timestamp; Date is the fallback. */
    @NotBlank
    private String timestampHeader = "x-sk-date";

    /** Prefix of the extension headers included in the signature. */
    @NotBlank
    private String headerPrefix = "x-sk-";

    /** Header carrying the content digest of requests with a body. */
    @NotBlank
    private String contentDigestHeader = "Content-Digest";

    /** JCA MAC algorithm: HmacSHA256 or HmacSHA512. */
    @NotBlank
    private String algorithm = "HmacSHA256";

    /** Maximum accepted age of a request timestamp. */
    @NotNull
    private Duration maxMessageAge = Duration.ofMinutes(5);

    /** How far in the future a timestamp may lie. */
    @NotNull
    private Duration clockSkew = Duration.ofMinutes(1);

    /** Status for expired requests: 403 (default) or 401. */
    @Min(401)
    @Max(403)
    private int expiredStatus = 403;

    /** Reject requests that declare a body without Content-Type and the digest header (412). */
    private boolean requireContentHeadersForBody = true;

    /** Log unknown accounts separately from signature mismatches (debug level only). */
    private boolean distinguishUnknownAccountInLogs = false;

    /** Ant-style paths served without authentication, e.g. /actuator/health. */
    @NotNull
    private List<String> publicPaths = new ArrayList<>();

    /** Optional explicit filter order; if null, defaults to SharedKeyWebAutoConfiguration.DEFAULT_ORDER. */
    private Integer order;

    // Getters / Setters
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getScheme() { return scheme; }
    public void setScheme(String scheme) { this.scheme = scheme; }

    public String getTimestampHeader() { return timestampHeader; }
    public void setTimestampHeader(String timestampHeader) { this.timestampHeader = timestampHeader; }

    public String getHeaderPrefix() { return headerPrefix; }
    public void setHeaderPrefix(String headerPrefix) { this.headerPrefix = headerPrefix; }

    public String getContentDigestHeader() { return contentDigestHeader; }
    public void setContentDigestHeader(String contentDigestHeader) { this.contentDigestHeader = contentDigestHeader; }

    public String getAlgorithm() { return algorithm; }
    public void setAlgorithm(String algorithm) { this.algorithm = algorithm; }

    public Duration getMaxMessageAge() { return maxMessageAge; }
    public void setMaxMessageAge(Duration maxMessageAge) { this.maxMessageAge = maxMessageAge; }

    public Duration getClockSkew() { return clockSkew; }
    public void setClockSkew(Duration clockSkew) { this.clockSkew = clockSkew; }

    public int getExpiredStatus() { return expiredStatus; }
    public void setExpiredStatus(int expiredStatus) { this.expiredStatus = expiredStatus; }

    public boolean isRequireContentHeadersForBody() { return requireContentHeadersForBody; }
    public void setRequireContentHeadersForBody(boolean require) { this.requireContentHeadersForBody = require; }

    public boolean isDistinguishUnknownAccountInLogs() { return distinguishUnknownAccountInLogs; }
    public void setDistinguishUnknownAccountInLogs(boolean distinguish) { this.distinguishUnknownAccountInLogs = distinguish; }

    public List<String> getPublicPaths() { return publicPaths; }
    public void setPublicPaths(List<String> publicPaths) {
        this.publicPaths = (publicPaths == null) ? new ArrayList<>() : new ArrayList<>(publicPaths);
    }

    public Integer getOrder() { return order; }
    public void setOrder(Integer order) { this.order = order; }
}
