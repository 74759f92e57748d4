package com.example.translator.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String AUTH_BASE = "/auth";
    public static final String HEALTH_BASE = "/health";

    // Auth paths
    public static final String LOGIN = "/login";
    public static final String LOGOUT = "/logout";
    public static final String ME = "/me";

    // Translation paths
    public static final String TRANSLATE_STREAM = "/translate-stream";
    public static final String CACHE_STATUS = "/cache-status";
    public static final String CACHE = "/cache";

    // Health paths
    public static final String LIVE = "/live";
    public static final String READY = "/ready";

    private ApiPath() {}
  }

  private ApiConstants() {}
}
