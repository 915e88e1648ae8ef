package my.pietracker.app.client;

public record CacheKey(String scope, String method, String url) {
}
