package eu.virtualparadox.techrag.ingest.extractor;

import eu.virtualparadox.techrag.ingest.cleaner.TextCleaner;
import eu.virtualparadox.techrag.ingest.model.ESourceType;
import eu.virtualparadox.techrag.ingest.model.ExtractedDocument;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.UnsupportedMimeTypeException;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;

/**
 * Fetches a web page and reduces it to its visible content text.
 * <p>
 * The fetch carries a bounded timeout and is retried a bounded number of times on I/O errors and
 * 5xx responses (client errors and non-HTML content are not retried). Scripts, styles, navigation, headers, footers and
 * asides are removed before the text is taken; whitespace is collapsed deterministically.
 * </p>
 */
@Service
@Slf4j
public class WebPageExtractor {

    static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";
    static final String NON_CONTENT = "script, style, noscript, nav, header, footer, aside";
    static final String UNKNOWN_TITLE = "Unknown";

    private final TextCleaner textCleaner;
    private final int timeoutMs;
    private final Retry retry;

    public WebPageExtractor(final TextCleaner textCleaner,
                            @Value("${techrag.web.timeout-ms:30000}") final int timeoutMs,
                            @Value("${techrag.web.max-attempts:3}") final int maxAttempts,
                            @Value("${techrag.web.retry-wait-ms:1000}") final long retryWaitMs) {
        if (timeoutMs <= 0 || maxAttempts < 1) {
            throw new IllegalArgumentException("timeoutMs must be positive and maxAttempts at least 1");
        }
        this.textCleaner = textCleaner;
        this.timeoutMs = timeoutMs;
        this.retry = Retry.of("web-fetch", RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(Duration.ofMillis(retryWaitMs))
                .retryOnException(WebPageExtractor::isTransient)
                .build());
    }

    /**
     * @param url absolute http(s) URL
     * @return the page's visible text; blank when the page has no content
     * @throws ExtractionException when the page cannot be fetched within the retry budget
     */
    public ExtractedDocument extract(final String url) {
        final Document page;
        try {
            page = retry.executeCallable(() -> fetch(url));
        }
        catch (Exception e) {
            throw new ExtractionException("Failed to fetch " + url, e);
        }
        return fromDocument(url, page);
    }

    /**
     * Applies the content extraction rules to already downloaded HTML.
     */
    ExtractedDocument fromHtml(final String url, final String html) {
        return fromDocument(url, Jsoup.parse(html, url));
    }

    private Document fetch(final String url) throws IOException {
        log.debug("Fetching {}", url);
        return Jsoup.connect(url)
                .userAgent(USER_AGENT)
                .timeout(timeoutMs)
                .followRedirects(true)
                .get();
    }

    private ExtractedDocument fromDocument(final String url, final Document page) {
        final String title = page.title() == null || page.title().isBlank() ? UNKNOWN_TITLE : page.title().trim();

        page.select(NON_CONTENT).remove();
        final Element body = page.body();
        final String text = body == null ? "" : textCleaner.cleanText(body.text());

        return new ExtractedDocument(url, ESourceType.WEB, title, text);
    }

    private static boolean isTransient(final Throwable e) {
        if (e instanceof HttpStatusException status) {
            return status.getStatusCode() >= 500;
        }
        if (e instanceof UnsupportedMimeTypeException) {
            return false;
        }
        return e instanceof IOException;
    }
}
