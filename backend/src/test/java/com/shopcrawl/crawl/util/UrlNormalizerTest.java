package com.shopcrawl.crawl.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UrlNormalizerTest {

    @Test
    void collapsesEquivalentSpellingsToOneForm() {
        String canonical = UrlNormalizer.normalize("https://shop.example/products?color=red&size=m");

        assertThat(UrlNormalizer.normalize("HTTPS://Shop.Example:443/products/?size=m&color=red#reviews"))
            .isEqualTo(canonical);
        assertThat(UrlNormalizer.normalize("https://shop.example./products?size=m&color=red"))
            .isEqualTo(canonical);
        assertThat(canonical).isEqualTo("https://shop.example/products?color=red&size=m");
    }

    @Test
    void keepsPathCaseAndNonDefaultPort() {
        assertThat(UrlNormalizer.normalize("http://shop.example:8080/Catalog/Item"))
            .isEqualTo("http://shop.example:8080/Catalog/Item");
        assertThat(UrlNormalizer.normalize("http://shop.example:80"))
            .isEqualTo("http://shop.example/");
    }

    @Test
    void distinctResourcesStayDistinct() {
        assertThat(UrlNormalizer.normalize("https://shop.example/a"))
            .isNotEqualTo(UrlNormalizer.normalize("https://shop.example/A"));
        assertThat(UrlNormalizer.normalize("https://shop.example/p?id=1"))
            .isNotEqualTo(UrlNormalizer.normalize("https://shop.example/p?id=2"));
        assertThat(UrlNormalizer.normalize("http://shop.example/"))
            .isNotEqualTo(UrlNormalizer.normalize("https://shop.example/"));
    }

    @Test
    void rejectsNonHttpAndMalformedInput() {
        assertThat(UrlNormalizer.normalize(null)).isNull();
        assertThat(UrlNormalizer.normalize("  ")).isNull();
        assertThat(UrlNormalizer.normalize("mailto:sales@shop.example")).isNull();
        assertThat(UrlNormalizer.normalize("javascript:void(0)")).isNull();
        assertThat(UrlNormalizer.normalize("/relative/path")).isNull();
        assertThat(UrlNormalizer.normalize("https://bad host/x")).isNull();
    }

    @Test
    void seedsMayBeBareDomains() {
        assertThat(UrlNormalizer.seedToUrl("Shop.Example")).isEqualTo("https://shop.example/");
        assertThat(UrlNormalizer.seedToUrl("http://shop.example/sale")).isEqualTo("http://shop.example/sale");
        assertThat(UrlNormalizer.seedToUrl(" ")).isNull();
    }

    @Test
    void domainIgnoresLeadingWww() {
        assertThat(UrlNormalizer.domainOf("https://www.shop.example/cart")).isEqualTo("shop.example");
        assertThat(UrlNormalizer.domainOf("https://shop.example/cart")).isEqualTo("shop.example");
    }

    @Test
    void scopeAcceptsSubdomainsOfSeeds() {
        List<String> seeds = List.of("shop.example");
        assertThat(UrlNormalizer.isWithinDomains("https://www.shop.example/x", seeds)).isTrue();
        assertThat(UrlNormalizer.isWithinDomains("https://cdn.shop.example/x", seeds)).isTrue();
        assertThat(UrlNormalizer.isWithinDomains("https://othershop.example/x", seeds)).isFalse();
        assertThat(UrlNormalizer.isWithinDomains("https://shop.example.evil/x", seeds)).isFalse();
    }
}
