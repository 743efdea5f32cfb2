package io.swapgate.backend.security;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.security")
public class SecurityProperties implements InitializingBean {
  static final long MAX_SIGNATURE_AGE_SECONDS = 300;

  private boolean metricsEnabled = true;
  private String counterStore = "redis";
  private String hmacSecret = "";
  private long signatureMaxAgeSeconds = 300;
  private String allowedOrigins = "http://localhost:5000";
  private String allowedOriginSuffixes = "";
  private String addressBlacklist = "0x0000000000000000000000000000000000000000";
  private String defaultTier = "MODERATE";

  private Map<String, Tier> tiers = defaultTiers();
  private List<Route> routes = new ArrayList<>();

  private static Map<String, Tier> defaultTiers() {
    Map<String, Tier> out = new LinkedHashMap<>();
    out.put("STRICT", new Tier(900, 10));
    out.put("MODERATE", new Tier(900, 100));
    out.put("RELAXED", new Tier(900, 500));
    out.put("TRADING", new Tier(60, 60));
    out.put("PAYMENT", new Tier(900, 20));
    return out;
  }

  @Override
  public void afterPropertiesSet() {
    if (signatureMaxAgeSeconds < 1 || signatureMaxAgeSeconds > MAX_SIGNATURE_AGE_SECONDS) {
      throw new IllegalStateException(
          "app.security.signature-max-age-seconds must be between 1 and " + MAX_SIGNATURE_AGE_SECONDS);
    }
    for (Map.Entry<String, Tier> e : tiers.entrySet()) {
      if (e.getValue().getWindowSeconds() < 1 || e.getValue().getMaxRequests() < 1) {
        throw new IllegalStateException("rate limit tier " + e.getKey() + " needs a positive window and max");
      }
    }
    if (!isBlank(defaultTier) && findTier(defaultTier) == null) {
      throw new IllegalStateException("app.security.default-tier names unknown tier " + defaultTier);
    }
    for (Route route : routes) {
      if (isBlank(route.getPathPrefix())) {
        throw new IllegalStateException("app.security.routes entries need a path-prefix");
      }
      if (!isBlank(route.getTier()) && findTier(route.getTier()) == null) {
        throw new IllegalStateException(
            "route " + route.getPathPrefix() + " names unknown tier " + route.getTier());
      }
      if (route.isSignatureRequired() && isBlank(hmacSecret)) {
        throw new IllegalStateException(
            "route " + route.getPathPrefix() + " requires signatures but app.security.hmac-secret is empty");
      }
    }
    if (!"redis".equals(counterStore) && !"memory".equals(counterStore)) {
      throw new IllegalStateException("app.security.counter-store must be redis or memory");
    }
  }

  /** Most specific configured route for a path, or the default-tier route. */
  public Route resolveRoute(String path) {
    String p = path == null ? "" : path;
    return routes.stream()
        .filter(r -> p.startsWith(r.getPathPrefix()))
        .max(Comparator.comparingInt(r -> r.getPathPrefix().length()))
        .orElseGet(() -> new Route("/", defaultTier, false));
  }

  public RateLimitTier rateLimitTier(String name) {
    Tier tier = findTier(name);
    if (tier == null) throw new IllegalArgumentException("unknown rate limit tier: " + name);
    return tier.toRateLimitTier(name.toUpperCase(Locale.ROOT));
  }

  private Tier findTier(String name) {
    if (name == null) return null;
    Tier t = tiers.get(name);
    return t != null ? t : tiers.get(name.toUpperCase(Locale.ROOT));
  }

  public List<String> allowedOriginList() {
    return splitCsv(allowedOrigins);
  }

  public List<String> allowedOriginSuffixList() {
    return splitCsv(allowedOriginSuffixes);
  }

  public List<String> addressBlacklistList() {
    return splitCsv(addressBlacklist);
  }

  private static List<String> splitCsv(String value) {
    if (value == null || value.isBlank()) return List.of();
    return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  public boolean isMetricsEnabled() {
    return metricsEnabled;
  }

  public void setMetricsEnabled(boolean metricsEnabled) {
    this.metricsEnabled = metricsEnabled;
  }

  public String getCounterStore() {
    return counterStore;
  }

  public void setCounterStore(String counterStore) {
    this.counterStore = counterStore;
  }

  public String getHmacSecret() {
    return hmacSecret;
  }

  public void setHmacSecret(String hmacSecret) {
    this.hmacSecret = hmacSecret;
  }

  public long getSignatureMaxAgeSeconds() {
    return signatureMaxAgeSeconds;
  }

  public void setSignatureMaxAgeSeconds(long signatureMaxAgeSeconds) {
    this.signatureMaxAgeSeconds = signatureMaxAgeSeconds;
  }

  public String getAllowedOrigins() {
    return allowedOrigins;
  }

  public void setAllowedOrigins(String allowedOrigins) {
    this.allowedOrigins = allowedOrigins;
  }

  public String getAllowedOriginSuffixes() {
    return allowedOriginSuffixes;
  }

  public void setAllowedOriginSuffixes(String allowedOriginSuffixes) {
    this.allowedOriginSuffixes = allowedOriginSuffixes;
  }

  public String getAddressBlacklist() {
    return addressBlacklist;
  }

  public void setAddressBlacklist(String addressBlacklist) {
    this.addressBlacklist = addressBlacklist;
  }

  public String getDefaultTier() {
    return defaultTier;
  }

  public void setDefaultTier(String defaultTier) {
    this.defaultTier = defaultTier;
  }

  public Map<String, Tier> getTiers() {
    return tiers;
  }

  public void setTiers(Map<String, Tier> tiers) {
    this.tiers = tiers;
  }

  public List<Route> getRoutes() {
    return routes;
  }

  public void setRoutes(List<Route> routes) {
    this.routes = routes;
  }

  public static class Tier {
    private long windowSeconds;
    private int maxRequests;
    /** Requests allowed before slowing down; negative means half of maxRequests. */
    private int delayAfter = -1;
    private long maxDelayMs = 3000;

    public Tier() {}

    public Tier(long windowSeconds, int maxRequests) {
      this.windowSeconds = windowSeconds;
      this.maxRequests = maxRequests;
    }

    RateLimitTier toRateLimitTier(String name) {
      int after = delayAfter < 0 ? (int) Math.floor(maxRequests * 0.5) : delayAfter;
      return new RateLimitTier(
          name,
          Duration.ofSeconds(windowSeconds),
          maxRequests,
          after,
          Duration.ofMillis(Math.max(0, maxDelayMs)));
    }

    public long getWindowSeconds() {
      return windowSeconds;
    }

    public void setWindowSeconds(long windowSeconds) {
      this.windowSeconds = windowSeconds;
    }

    public int getMaxRequests() {
      return maxRequests;
    }

    public void setMaxRequests(int maxRequests) {
      this.maxRequests = maxRequests;
    }

    public int getDelayAfter() {
      return delayAfter;
    }

    public void setDelayAfter(int delayAfter) {
      this.delayAfter = delayAfter;
    }

    public long getMaxDelayMs() {
      return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
    }
  }

  public static class Route {
    private String pathPrefix;
    private String tier;
    private boolean signatureRequired;

    public Route() {}

    public Route(String pathPrefix, String tier, boolean signatureRequired) {
      this.pathPrefix = pathPrefix;
      this.tier = tier;
      this.signatureRequired = signatureRequired;
    }

    public String getPathPrefix() {
      return pathPrefix;
    }

    public void setPathPrefix(String pathPrefix) {
      this.pathPrefix = pathPrefix;
    }

    public String getTier() {
      return tier;
    }

    public void setTier(String tier) {
      this.tier = tier;
    }

    public boolean isSignatureRequired() {
      return signatureRequired;
    }

    public void setSignatureRequired(boolean signatureRequired) {
      this.signatureRequired = signatureRequired;
    }
  }
}
