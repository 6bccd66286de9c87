package com.jobscout.links.pages;

import com.jobscout.links.http.PoliteHttpClient;
import com.jobscout.links.model.HttpFetchResult;
import com.jobscout.links.model.PageLinks;
import com.jobscout.links.model.RawLink;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fetches a career page and harvests every anchor with an href. Hrefs are kept as written;
 * resolution against the page happens during triage.
 */
@Component
public class CareerPageFetcher {
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final PoliteHttpClient httpClient;

    public CareerPageFetcher(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public PageLinks fetch(String sourcePageUrl) {
        HttpFetchResult result = httpClient.get(sourcePageUrl, HTML_ACCEPT);
        if (!result.isSuccessful()) {
            String code = result.errorCode() != null ? result.errorCode() : "http_" + result.statusCode();
            String message = result.errorMessage() != null
                ? result.errorMessage()
                : "unexpected status " + result.statusCode() + " from " + result.finalUrlOrRequested();
            return PageLinks.failed(sourcePageUrl, code, message);
        }
        return new PageLinks(sourcePageUrl, extractLinks(result.body(), sourcePageUrl), null, null);
    }

    public static List<RawLink> extractLinks(String html, String sourcePageUrl) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document doc = Jsoup.parse(html, sourcePageUrl);
        List<RawLink> links = new ArrayList<>();
        for (Element anchor : doc.select("a[href]")) {
            links.add(new RawLink(anchor.attr("href"), anchor.text(), sourcePageUrl));
        }
        return links;
    }
}
