package com.hypecycle.core.collector;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Endpoints, credentials and timeouts for the five collectors, bound from {@code hypecycle.collectors.*}.
 */
@Component
@ConfigurationProperties(prefix = "hypecycle.collectors")
public class CollectorProperties {

    private int requestTimeoutSeconds = 30;
    private String userAgent = "hypecycle/0.1";
    private String socialUrl = "https://hn.algolia.com/api/v1/search";
    private String papersUrl = "https://api.semanticscholar.org/graph/v1/paper/search/bulk";
    private String patentsUrl = "https://search.patentsview.org/api/v1/patent/";
    private String newsUrl = "https://api.gdeltproject.org/api/v2/doc/doc";
    private String financeSearchUrl = "https://query2.finance.yahoo.com/v1/finance/search";
    private String financeChartUrl = "https://query1.finance.yahoo.com/v8/finance/chart/";
    private String semanticScholarApiKey = "";
    private String patentsviewApiKey = "";

    public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }
    public String getSocialUrl() { return socialUrl; }
    public void setSocialUrl(String socialUrl) { this.socialUrl = socialUrl; }
    public String getPapersUrl() { return papersUrl; }
    public void setPapersUrl(String papersUrl) { this.papersUrl = papersUrl; }
    public String getPatentsUrl() { return patentsUrl; }
    public void setPatentsUrl(String patentsUrl) { this.patentsUrl = patentsUrl; }
    public String getNewsUrl() { return newsUrl; }
    public void setNewsUrl(String newsUrl) { this.newsUrl = newsUrl; }
    public String getFinanceSearchUrl() { return financeSearchUrl; }
    public void setFinanceSearchUrl(String financeSearchUrl) { this.financeSearchUrl = financeSearchUrl; }
    public String getFinanceChartUrl() { return financeChartUrl; }
    public void setFinanceChartUrl(String financeChartUrl) { this.financeChartUrl = financeChartUrl; }
    public String getSemanticScholarApiKey() { return semanticScholarApiKey; }
    public void setSemanticScholarApiKey(String semanticScholarApiKey) { this.semanticScholarApiKey = semanticScholarApiKey; }
    public String getPatentsviewApiKey() { return patentsviewApiKey; }
    public void setPatentsviewApiKey(String patentsviewApiKey) { this.patentsviewApiKey = patentsviewApiKey; }

    public boolean hasSemanticScholarApiKey() {
        return semanticScholarApiKey != null && !semanticScholarApiKey.isBlank();
    }

    public boolean hasPatentsviewApiKey() {
        return patentsviewApiKey != null && !patentsviewApiKey.isBlank();
    }
}
