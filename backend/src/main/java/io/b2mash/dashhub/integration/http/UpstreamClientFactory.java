package io.b2mash.dashhub.integration.http;

import io.b2mash.dashhub.integration.IntegrationConfig;
import io.b2mash.dashhub.integration.IntegrationProperties;
import java.net.Socket;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Builds {@link RestClient}s for upstream instances. Each client gets the instance's base URL,
 * default auth headers and a request factory honouring the TLS-verification toggle and the call
 * timeout. The underlying JDK {@link HttpClient}s are shared, one per TLS mode.
 */
@Component
public class UpstreamClientFactory {

  private static final Logger log = LoggerFactory.getLogger(UpstreamClientFactory.class);

  private final RestClient.Builder template;
  private final BiFunction<Boolean, Duration, ClientHttpRequestFactory> requestFactories;

  @Autowired
  public UpstreamClientFactory(RestClient.Builder restClientBuilder, IntegrationProperties props) {
    this(restClientBuilder, new JdkRequestFactories(props.connectTimeout())::create);
  }

  /**
   * Test seam: a {@code requestFactories} function returning {@code null} keeps whatever request
   * factory the template builder already carries (e.g. one bound by {@code MockRestServiceServer}).
   */
  public UpstreamClientFactory(
      RestClient.Builder template,
      BiFunction<Boolean, Duration, ClientHttpRequestFactory> requestFactories) {
    this.template = template;
    this.requestFactories = requestFactories;
  }

  public RestClient create(
      IntegrationConfig config,
      String baseUrl,
      Duration timeout,
      Consumer<HttpHeaders> defaultHeaders) {
    var builder = template.clone().baseUrl(baseUrl).defaultHeaders(defaultHeaders);
    var requestFactory = requestFactories.apply(config.verifySsl(), timeout);
    if (requestFactory != null) {
      builder.requestFactory(requestFactory);
    }
    return builder.build();
  }

  public RestClient create(IntegrationConfig config, String baseUrl, Duration timeout) {
    return create(config, baseUrl, timeout, headers -> {});
  }

  private static final class JdkRequestFactories {

    private final Duration connectTimeout;
    private final Map<Boolean, HttpClient> clients = new ConcurrentHashMap<>();

    JdkRequestFactories(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    ClientHttpRequestFactory create(Boolean verifySsl, Duration readTimeout) {
      var factory =
          new JdkClientHttpRequestFactory(clients.computeIfAbsent(verifySsl, this::newClient));
      factory.setReadTimeout(readTimeout);
      return factory;
    }

    private HttpClient newClient(boolean verifySsl) {
      var builder =
          HttpClient.newBuilder()
              .connectTimeout(connectTimeout)
              .followRedirects(HttpClient.Redirect.NORMAL);
      if (!verifySsl) {
        log.warn("TLS certificate verification disabled for integrations that opt out of it");
        builder.sslContext(trustAllContext());
      }
      return builder.build();
    }

    private static SSLContext trustAllContext() {
      try {
        var context = SSLContext.getInstance("TLS");
        context.init(null, new TrustManager[] {new TrustAllManager()}, new SecureRandom());
        return context;
      } catch (GeneralSecurityException e) {
        throw new IllegalStateException("Cannot create TLS context without verification", e);
      }
    }
  }

  /**
   * Accepts any certificate chain and, being an extended trust manager, skips hostname checks.
   * Only installed for instances configured with {@code verify-ssl: false} (self-signed
   * appliances).
   */
  private static final class TrustAllManager extends X509ExtendedTrustManager {

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {}

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {}

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {}

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {}

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}
