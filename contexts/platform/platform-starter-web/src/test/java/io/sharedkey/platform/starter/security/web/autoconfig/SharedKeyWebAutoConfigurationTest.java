package io.sharedkey.platform.starter.security.web.autoconfig;

import static org.assertj.core.api.Assertions.assertThat;

import io.sharedkey.platform.application.signing.HmacAlgorithm;
import io.sharedkey.platform.application.signing.RequestSigner;
import io.sharedkey.platform.application.signing.SharedKeyScheme;
import io.sharedkey.platform.domain.auth.Identity;
import io.sharedkey.platform.domain.auth.IdentityTransformer;
import io.sharedkey.platform.domain.auth.SecretResolver;
import io.sharedkey.platform.domain.request.RequestHeaders;
import io.sharedkey.platform.domain.request.SignedRequest;
import io.sharedkey.platform.http.filters.SharedKeyAuthFilter;
import io.sharedkey.platform.http.pipeline.RequestPipeline;
import io.sharedkey.platform.http.pipeline.RequestStage;
import io.sharedkey.platform.http.pipeline.SharedKeyAuthenticationStage;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class SharedKeyWebAutoConfigurationTest {

  private static final Instant T0 = Instant.parse("2024-10-01T12:00:00Z");
  private static final byte[] SECRET = "K".getBytes(StandardCharsets.UTF_8);

  private final WebApplicationContextRunner runner =
      new WebApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(SharedKeyWebAutoConfiguration.class));

  @Test
  void disabledByDefault() {
    runner
        .withUserConfiguration(SecretsConfig.class)
        .run(ctx -> assertThat(ctx).doesNotHaveBean("sharedKeyAuthFilterRegistration"));
  }

  @Test
  void enabled_registersFilterAndPipeline() {
    runner
        .withUserConfiguration(SecretsConfig.class)
        .withPropertyValues("sharedkey.web.auth.enabled=true")
        .run(
            ctx -> {
              assertThat(ctx).hasBean("sharedKeyAuthFilterRegistration");
              FilterRegistrationBean<?> reg = ctx.getBean("sharedKeyAuthFilterRegistration", FilterRegistrationBean.class);
              assertThat(reg.getFilter()).isInstanceOf(SharedKeyAuthFilter.class);
              assertThat(reg.getOrder()).isEqualTo(SharedKeyWebAutoConfiguration.DEFAULT_ORDER);
              assertThat(reg.getUrlPatterns()).containsExactly("/*");

              RequestPipeline pipeline = ctx.getBean(RequestPipeline.class);
              assertThat(pipeline.stages()).hasSize(1);
              SharedKeyAuthenticationStage stage = (SharedKeyAuthenticationStage) pipeline.stages().get(0);
              assertThat(stage.maxAge()).hasMinutes(5);
              assertThat(stage.expiredStatus()).isEqualTo(403);
            });
  }

  @Test
  void properties_shapeScheme() {
    runner
        .withUserConfiguration(SecretsConfig.class)
        .withPropertyValues(
            "sharedkey.web.auth.enabled=true",
            "sharedkey.web.auth.algorithm=HmacSHA512",
            "sharedkey.web.auth.timestamp-header=x-acme-date",
            "sharedkey.web.auth.max-message-age=2m",
            "sharedkey.web.auth.expired-status=401",
            "sharedkey.web.auth.order=7")
        .run(
            ctx -> {
              SharedKeyScheme scheme = ctx.getBean(SharedKeyScheme.class);
              assertThat(scheme.algorithm()).isEqualTo(HmacAlgorithm.HMAC_SHA512);
              assertThat(scheme.timestampHeader()).isEqualTo("x-acme-date");
              var stage = (SharedKeyAuthenticationStage) ctx.getBean(RequestPipeline.class).stages().get(0);
              assertThat(stage.maxAge()).hasMinutes(2);
              assertThat(stage.expiredStatus()).isEqualTo(401);
              assertThat(ctx.getBean("sharedKeyAuthFilterRegistration", FilterRegistrationBean.class).getOrder())
                  .isEqualTo(7);
            });
  }

  @Test
  void extraStages_runAfterAuthentication() {
    runner
        .withUserConfiguration(SecretsConfig.class, ExtraStageConfig.class)
        .withPropertyValues("sharedkey.web.auth.enabled=true")
        .run(
            ctx -> {
              var stages = ctx.getBean(RequestPipeline.class).stages();
              assertThat(stages).hasSize(2);
              assertThat(stages.get(0)).isInstanceOf(SharedKeyAuthenticationStage.class);
            });
  }

  @Test
  void missingSecretResolver_failsStartup() {
    runner
        .withPropertyValues("sharedkey.web.auth.enabled=true")
        .run(ctx -> assertThat(ctx).hasFailed());
  }

  @Test
  void invalidExpiredStatus_failsStartup() {
    runner
        .withUserConfiguration(SecretsConfig.class)
        .withPropertyValues("sharedkey.web.auth.enabled=true", "sharedkey.web.auth.expired-status=500")
        .run(ctx -> assertThat(ctx).hasFailed());
  }

  @Test
  void unsupportedAlgorithm_failsStartup() {
    runner
        .withUserConfiguration(SecretsConfig.class)
        .withPropertyValues("sharedkey.web.auth.enabled=true", "sharedkey.web.auth.algorithm=HmacMD5")
        .run(ctx -> assertThat(ctx).hasFailed());
  }

  @Test
  void wiredFilter_authenticatesAndAppliesTransformer() {
    runner
        .withUserConfiguration(SecretsConfig.class, TransformerConfig.class)
        .withPropertyValues("sharedkey.web.auth.enabled=true")
        .run(
            ctx -> {
              var filter =
                  (SharedKeyAuthFilter) ctx.getBean("sharedKeyAuthFilterRegistration", FilterRegistrationBean.class).getFilter();
              var signed =
                  new RequestSigner(SharedKeyScheme.defaults(), Clock.fixed(T0, ZoneOffset.UTC))
                      .sign(new SignedRequest("GET", "/reports", "", RequestHeaders.empty()), "alice", SECRET);
              var request = new MockHttpServletRequest("GET", "/reports");
              signed.headers().toMap().forEach((n, vs) -> vs.forEach(v -> request.addHeader(n, v)));
              AtomicReference<Identity> seen = new AtomicReference<>();

              filter.doFilter(
                  request,
                  new MockHttpServletResponse(),
                  (req, res) -> seen.set((Identity) req.getAttribute(SharedKeyAuthFilter.REQUEST_ATTR_IDENTITY)));

              assertThat(seen.get()).isNotNull();
              assertThat(seen.get().hasClaim("role", "reader")).isTrue();
            });
  }

  @Configuration(proxyBeanMethods = false)
  static class SecretsConfig {
    @Bean
    SecretResolver secretResolver() {
      return SecretResolver.of(Map.of("alice", SECRET));
    }

    @Bean
    Clock clock() {
      return Clock.fixed(T0, ZoneOffset.UTC);
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class ExtraStageConfig {
    @Bean
    @Order(1)
    RequestStage auditStage() {
      return (request, next) -> next.proceed(request);
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class TransformerConfig {
    @Bean
    IdentityTransformer roleTransformer() {
      return (resource, identity) -> identity.toBuilder().claim("role", "reader").build();
    }
  }
}
