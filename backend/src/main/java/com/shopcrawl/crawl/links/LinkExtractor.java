package com.shopcrawl.crawl.links;

import com.shopcrawl.config.CrawlerProperties;
import com.shopcrawl.crawl.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outbound links of an HTML page, resolved against the URL the page was finally served from.
 * Results are normalized, http(s) only, de-duplicated in document order and capped per page.
 */
@Component
public class LinkExtractor {
    private final CrawlerProperties properties;

    public LinkExtractor(CrawlerProperties properties) {
        this.properties = properties;
    }

    /**
     * @param html    page HTML (nullable)
     * @param baseUrl base URL used to resolve relative hrefs
     */
    public List<String> extract(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        int cap = properties.getMaxLinksPerPage();
        Document doc = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : doc.select("a[href]")) {
            String href = anchor.attr("abs:href");
            if (href == null || href.isBlank()) {
                continue;
            }
            String normalized = UrlNormalizer.normalize(href.trim());
            if (normalized == null) {
                continue;
            }
            links.add(normalized);
            if (links.size() >= cap) {
                break;
            }
        }
        return new ArrayList<>(links);
    }
}
