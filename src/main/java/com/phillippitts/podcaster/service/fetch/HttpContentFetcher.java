package com.phillippitts.podcaster.service.fetch;

import com.phillippitts.podcaster.config.fetch.ContentFetchProperties;
import com.phillippitts.podcaster.domain.SourceKind;
import com.phillippitts.podcaster.domain.SourceReference;
import com.phillippitts.podcaster.exception.ContentFetchException;
import com.phillippitts.podcaster.util.LogSanitizer;
import com.phillippitts.podcaster.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Fetches HTML over HTTP(S) and removes script and style blocks before handing it on.
 */
@Component
public class HttpContentFetcher implements ContentFetcher {

    private static final Logger LOG = LogManager.getLogger(HttpContentFetcher.class);

    private static final Pattern NON_CONTENT_BLOCKS = Pattern.compile(
            "<(script|style|noscript|svg)\\b[^>]*>.*?</\\1\\s*>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern COMMENTS = Pattern.compile("<!--.*?-->", Pattern.DOTALL);

    private final HttpClient httpClient;
    private final ContentFetchProperties properties;

    public HttpContentFetcher(ContentFetchProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.timeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public String fetch(SourceReference source) {
        Objects.requireNonNull(source, "source");
        if (source.kind() != SourceKind.URL) {
            throw new ContentFetchException(source.detail(), "unsupported source kind " + source.kind(), null);
        }

        URI uri;
        try {
            uri = URI.create(source.detail());
        } catch (IllegalArgumentException e) {
            throw new ContentFetchException(source.detail(), "malformed URL", e);
        }
        if (uri.getScheme() == null || !uri.getScheme().toLowerCase().startsWith("http")) {
            throw new ContentFetchException(source.detail(), "only http and https URLs are supported", null);
        }

        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
                .header("User-Agent", properties.userAgent())
                .header("Accept", "text/html,application/xhtml+xml")
                .GET()
                .build();

        long start = System.nanoTime();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ContentFetchException(source.detail(), e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContentFetchException(source.detail(), "interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new ContentFetchException(source.detail(), response.statusCode());
        }
        String content = clean(response.body());
        if (content.isBlank()) {
            throw new ContentFetchException(source.detail(), "page has no content", null);
        }
        LOG.info("Fetched {} chars from {} in {}ms", content.length(), source.detail(), TimeUtils.elapsedMillis(start));
        return LogSanitizer.truncate(content, properties.maxChars());
    }

    static String clean(String html) {
        if (html == null) {
            return "";
        }
        String withoutComments = COMMENTS.matcher(html).replaceAll("");
        return NON_CONTENT_BLOCKS.matcher(withoutComments).replaceAll("").trim();
    }
}
