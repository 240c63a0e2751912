package io.sharedkey.platform.starter.security.web.autoconfig;

import static jakarta.servlet.DispatcherType.ASYNC;
import static jakarta.servlet.DispatcherType.ERROR;
import static jakarta.servlet.DispatcherType.REQUEST;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.sharedkey.platform.application.signing.HmacAlgorithm;
import io.sharedkey.platform.application.signing.SharedKeyScheme;
import io.sharedkey.platform.application.signing.SignatureValidator;
import io.sharedkey.platform.domain.auth.IdentityTransformer;
import io.sharedkey.platform.domain.auth.SecretResolver;
import io.sharedkey.platform.http.error.ProblemHttpMapper;
import io.sharedkey.platform.http.filters.SharedKeyAuthFilter;
import io.sharedkey.platform.http.pipeline.RequestPipeline;
import io.sharedkey.platform.http.pipeline.RequestStage;
import io.sharedkey.platform.http.pipeline.SharedKeyAuthenticationStage;
import jakarta.servlet.DispatcherType;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.core.Ordered;
import org.springframework.web.servlet.DispatcherServlet;

/**
 * Registers the SharedKey authentication filter. All wiring is confined to the starter;
 * domain/application remain framework-agnostic.
 *
 * <p>The host application supplies a {@link SecretResolver} bean. An {@link IdentityTransformer},
 * a {@link Clock}, a {@link MeterRegistry} and additional {@link RequestStage} beans are picked up
 * when present; extra stages run after authentication, in {@code @Order} order.
 */
@AutoConfiguration
@EnableConfigurationProperties(SharedKeyWebProperties.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnClass({DispatcherServlet.class, SharedKeyAuthFilter.class})
@ConditionalOnProperty(prefix = "sharedkey.web.auth", name = "enabled", havingValue = "true")
public class SharedKeyWebAutoConfiguration {

  /** Filter order used when {@code sharedkey.web.auth.order} is not set. */
  public static final int DEFAULT_ORDER = Ordered.HIGHEST_PRECEDENCE + 50;

  private static final EnumSet<DispatcherType> DEFAULT_DISPATCHERS =
      EnumSet.of(REQUEST, ERROR, ASYNC);

  /** Wire-level scheme built from the properties; shared by validator and any client signer. */
  @Bean
  @ConditionalOnMissingBean
  public SharedKeyScheme sharedKeyScheme(SharedKeyWebProperties p) {
    return SharedKeyScheme.builder()
        .scheme(p.getScheme())
        .timestampHeader(p.getTimestampHeader())
        .headerPrefix(p.getHeaderPrefix())
        .contentDigestHeader(p.getContentDigestHeader())
        .algorithm(HmacAlgorithm.fromJcaName(p.getAlgorithm()))
        .clockSkew(p.getClockSkew())
        .requireContentHeadersForBody(p.isRequireContentHeadersForBody())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public SignatureValidator sharedKeySignatureValidator(
      SharedKeyScheme scheme, ObjectProvider<Clock> clockProvider) {
    return new SignatureValidator(scheme, clockProvider.getIfAvailable(Clock::systemUTC));
  }

  /**
   * Assembles the pipeline: authentication first, then any application-supplied stages.
   *
   * @param p SharedKey web properties
   * @param validator signature validator
   * @param secretResolver resolves account secrets (required)
   * @param identityTransformer optional identity post-processing
   * @param metrics optional Micrometer registry for outcome counters
   * @param extraStages optional stages appended after authentication
   * @return the immutable pipeline
   */
  @Bean(name = "sharedKeyRequestPipeline")
  @ConditionalOnMissingBean(name = "sharedKeyRequestPipeline")
  public RequestPipeline sharedKeyRequestPipeline(
      SharedKeyWebProperties p,
      SignatureValidator validator,
      SecretResolver secretResolver,
      ObjectProvider<IdentityTransformer> identityTransformer,
      ObjectProvider<MeterRegistry> metrics,
      ObjectProvider<RequestStage> extraStages) {
    SharedKeyAuthenticationStage authentication =
        SharedKeyAuthenticationStage.builder(validator, secretResolver)
            .maxAge(p.getMaxMessageAge())
            .expiredStatus(p.getExpiredStatus())
            .identityTransformer(identityTransformer.getIfAvailable())
            .distinguishUnknownAccountInLogs(p.isDistinguishUnknownAccountInLogs())
            .meterRegistry(metrics.getIfAvailable())
            .build();

    List<RequestStage> stages = new ArrayList<>();
    stages.add(authentication);
    extraStages.orderedStream().forEach(stages::add);
    return RequestPipeline.of(stages);
  }

  @Bean
  @ConditionalOnMissingBean
  public ProblemHttpMapper sharedKeyProblemHttpMapper(ObjectProvider<ObjectMapper> objectMapper) {
    return new ProblemHttpMapper(objectMapper.getIfAvailable(ObjectMapper::new));
  }

  /**
   * Registers the {@link SharedKeyAuthFilter} for all paths.
   *
   * @param p SharedKey web properties
   * @param pipeline the request pipeline
   * @param problemMapper writes rejections as problem+json
   * @return the filter registration bean
   */
  @Bean(name = "sharedKeyAuthFilterRegistration")
  @ConditionalOnMissingBean(name = "sharedKeyAuthFilterRegistration")
  public FilterRegistrationBean<SharedKeyAuthFilter> sharedKeyAuthFilter(
      SharedKeyWebProperties p, RequestPipeline pipeline, ProblemHttpMapper problemMapper) {
    SharedKeyAuthFilter filter = new SharedKeyAuthFilter(pipeline, problemMapper, p.getPublicPaths());

    FilterRegistrationBean<SharedKeyAuthFilter> reg = new FilterRegistrationBean<>(filter);
    reg.setDispatcherTypes(DEFAULT_DISPATCHERS);
    reg.setOrder(p.getOrder() != null ? p.getOrder() : DEFAULT_ORDER);
    reg.addUrlPatterns("/*");
    reg.setAsyncSupported(true);
    return reg;
  }
}
