package com.acme.jobqueue.config;

import com.acme.jobqueue.core.QueueConfigurationException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Backend connection parameters resolved from a {@code redis://} or {@code rediss://} URL.
 * Immutable; built once per process.
 */
public final class QueueConnection {
  public static final int DEFAULT_PORT = 6379;

  private static final String PLAIN_SCHEME = "redis";
  private static final String SECURE_SCHEME = "rediss";

  private final String host;
  private final int port;
  private final String credential;
  private final boolean secureTransport;

  public QueueConnection(String host, int port, String credential, boolean secureTransport) {
    this.host = Objects.requireNonNull(host, "host");
    this.port = port;
    this.credential = credential;
    this.secureTransport = secureTransport;
  }

  /**
   * Parses a connection URL such as {@code rediss://:secret@cache.internal:6380}.
   *
   * @throws QueueConfigurationException if the URL is missing, malformed, has no host or uses a
   *     scheme other than redis/rediss
   */
  public static QueueConnection parse(String url) {
    if (url == null || url.isBlank()) {
      throw new QueueConfigurationException("Queue connection URL is not configured");
    }
    URI uri;
    try {
      uri = new URI(url.trim());
    } catch (URISyntaxException e) {
      throw new QueueConfigurationException("Invalid queue connection URL: " + e.getMessage(), e);
    }

    String scheme = uri.getScheme();
    if (!PLAIN_SCHEME.equalsIgnoreCase(scheme) && !SECURE_SCHEME.equalsIgnoreCase(scheme)) {
      throw new QueueConfigurationException(
          "Unsupported queue connection scheme: " + scheme + " (expected redis or rediss)");
    }
    String host = uri.getHost();
    if (host == null || host.isEmpty()) {
      throw new QueueConfigurationException("Queue connection URL has no host");
    }

    int port = uri.getPort() == -1 ? DEFAULT_PORT : uri.getPort();
    return new QueueConnection(
        host, port, passwordOf(uri.getRawUserInfo()), SECURE_SCHEME.equalsIgnoreCase(scheme));
  }

  // userinfo is "password", ":password" or "user:password"; only the password is used
  private static String passwordOf(String rawUserInfo) {
    if (rawUserInfo == null || rawUserInfo.isEmpty()) {
      return null;
    }
    int colon = rawUserInfo.indexOf(':');
    String password = colon >= 0 ? rawUserInfo.substring(colon + 1) : rawUserInfo;
    if (password.isEmpty()) {
      return null;
    }
    return URLDecoder.decode(password, StandardCharsets.UTF_8);
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  public Optional<String> getCredential() {
    return Optional.ofNullable(credential);
  }

  public boolean isSecureTransport() {
    return secureTransport;
  }

  /** Address in the form Redisson expects, e.g. {@code rediss://host:6380}. */
  public String toAddress() {
    return (secureTransport ? SECURE_SCHEME : PLAIN_SCHEME) + "://" + host + ":" + port;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QueueConnection that)) {
      return false;
    }
    return port == that.port
        && secureTransport == that.secureTransport
        && host.equals(that.host)
        && Objects.equals(credential, that.credential);
  }

  @Override
  public int hashCode() {
    return Objects.hash(host, port, credential, secureTransport);
  }

  @Override
  public String toString() {
    return "QueueConnection{"
        + toAddress()
        + (credential != null ? ", credential=****" : "")
        + "}";
  }
}
