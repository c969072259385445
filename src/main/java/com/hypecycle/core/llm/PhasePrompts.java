package com.hypecycle.core.llm;

import com.hypecycle.core.model.PhaseOpinion;
import com.hypecycle.core.model.SourceMetrics;
import com.hypecycle.core.model.SourceName;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Prompt text for the three classifier operations.
 */
public final class PhasePrompts {

    public static final String SYSTEM_PROMPT = """
            You are a technology analyst who places technologies on the Gartner hype cycle.
            You answer with a single JSON object and nothing else.
            """;

    static final String PHASE_DEFINITIONS = """
            Hype Cycle Phases:
            1. innovation_trigger (Innovation Trigger): New technology concept emerges, limited mentions/publications/patents, early adopters experimenting, low engagement/citations, narrow focus
            2. peak (Peak of Inflated Expectations): Explosive growth in all metrics, very high social media buzz, rapid increase in publications/patents, mainstream media coverage begins, high sentiment/optimism, accelerating momentum
            3. trough (Trough of Disillusionment): Declining mentions from peak levels, negative sentiment shift, publication/patent growth slows or reverses, media coverage drops, investor sentiment turns negative, reality check on limitations
            4. slope (Slope of Enlightenment): Stabilizing metrics after trough, improving sentiment from lows, steady sustainable growth, maturing research and patents, practical applications emerge, institutional adoption begins
            5. plateau (Plateau of Productivity): Sustained moderate activity, neutral sentiment (technology normalized), stable publication/patent rates, broad established field, mainstream adoption, mature market
            """;

    private static final String OPINION_FORMAT = """
            Return ONLY a JSON object with no markdown formatting:
            {"phase": "one of: innovation_trigger, peak, trough, slope, plateau", "confidence": 0.75, "reasoning": "%s"}""";

    private PhasePrompts() {}

    /**
     * Per-source prompt: the source's metrics, the phase definitions and source-specific
     * interpretation guidance.
     */
    public static String sourcePrompt(String keyword, SourceMetrics metrics) {
        return switch (metrics.source()) {
            case SOCIAL -> socialPrompt(keyword, metrics);
            case PAPERS -> papersPrompt(keyword, metrics);
            case PATENTS -> patentsPrompt(keyword, metrics);
            case NEWS -> newsPrompt(keyword, metrics);
            case FINANCE -> financePrompt(keyword, metrics);
        };
    }

    private static String socialPrompt(String keyword, SourceMetrics m) {
        return """
                You are analyzing social media signals from Hacker News to determine the hype cycle phase for "%s".

                Data provided:
                - Mentions: 30d=%d, 6m=%s, 1y=%s, total=%d
                - Engagement: avg_points_30d=%s, avg_comments_30d=%s
                - Sentiment: %s (range: -1.0 to 1.0)
                - Trends: growth=%s, momentum=%s
                - Recency: %s

                %s
                Interpretation guidance:
                - innovation_trigger: Low mentions (<50 total), low engagement, early buzz
                - peak: Very high mentions (>200 in 30d), high sentiment (>0.5), accelerating momentum
                - trough: Declining mentions from previous peak, negative sentiment shift
                - slope: Stabilizing mentions, improving sentiment, steady growth
                - plateau: Sustained moderate volume, neutral sentiment (0.0-0.3), stable trend

                Based on these social media signals, classify the hype cycle phase.

                %s""".formatted(keyword,
                m.recentVolume(), count(m, "mentions_6m"), count(m, "mentions_1y"), m.totalVolume(),
                decimal(m, "avg_points_30d", 1), decimal(m, "avg_comments_30d", 1),
                decimal(m, "sentiment", 2),
                m.text("growth_trend", "unknown"), m.text("momentum", "unknown"),
                m.text("recency", "unknown"),
                PHASE_DEFINITIONS, opinionFormat("1-2 sentence explanation"));
    }

    private static String papersPrompt(String keyword, SourceMetrics m) {
        return """
                You are analyzing academic research signals from Semantic Scholar for "%s".

                Data provided:
                - Publications: 2y=%d, 5y=%s, total=%d
                - Citations: avg_2y=%s, avg_5y=%s
                - Citation velocity: %s (positive = accelerating citations)
                - Research maturity: %s
                - Research momentum: %s
                - Research breadth: %s
                - Author diversity: %s
                - Venue diversity: %s

                %s
                Interpretation guidance:
                - innovation_trigger: Emerging field (<10 papers in 2y), low citations (<5 avg), narrow breadth
                - peak: Rapid publication growth, high momentum (accelerating), broad research, many authors
                - trough: Declining publications, negative citation velocity, narrowing focus
                - slope: Steady publications, mature field, moderate citations, improving velocity
                - plateau: Stable publication rate, high citations, broad established field

                Based on these academic signals, classify the hype cycle phase.

                %s""".formatted(keyword,
                m.recentVolume(), count(m, "publications_5y"), m.totalVolume(),
                decimal(m, "avg_citations_2y", 1), decimal(m, "avg_citations_5y", 1),
                decimal(m, "citation_velocity", 2),
                m.text("research_maturity", "unknown"), m.text("research_momentum", "unknown"),
                m.text("research_breadth", "unknown"),
                count(m, "author_diversity"), count(m, "venue_diversity"),
                PHASE_DEFINITIONS, opinionFormat("1-2 sentence explanation"));
    }

    private static String patentsPrompt(String keyword, SourceMetrics m) {
        return """
                You are analyzing patent filing signals from PatentsView for "%s".

                Data provided:
                - Patent filings: 2y=%d, 5y=%s, 10y=%s, total=%d
                - Citations: avg_2y=%s, avg_5y=%s
                - Filing velocity: %s (positive = accelerating filings)
                - Unique assignees: %s
                - Assignee concentration: %s
                - Geographic diversity: %s countries
                - Geographic reach: %s
                - Patent maturity: %s
                - Patent momentum: %s

                %s
                Interpretation guidance:
                - innovation_trigger: Few patents (<10 in 2y), concentrated assignees (1-3 companies), domestic only
                - peak: Rapid filing growth, many assignees (>20), global reach, accelerating momentum
                - trough: Declining filings from peak, consolidation (fewer assignees), slowing velocity
                - slope: Steady filings, maturing patents, diverse assignees, moderate citations
                - plateau: Stable filing rate, established field, high citations, global coverage

                Based on these patent signals, classify the hype cycle phase.

                %s""".formatted(keyword,
                m.recentVolume(), count(m, "patents_5y"), count(m, "patents_10y"), m.totalVolume(),
                decimal(m, "avg_citations_2y", 1), decimal(m, "avg_citations_5y", 1),
                decimal(m, "filing_velocity", 2),
                count(m, "unique_assignees"), m.text("assignee_concentration", "unknown"),
                count(m, "geographic_diversity"), m.text("geographic_reach", "unknown"),
                m.text("patent_maturity", "unknown"), m.text("patent_momentum", "unknown"),
                PHASE_DEFINITIONS, opinionFormat("1-2 sentence explanation"));
    }

    private static String newsPrompt(String keyword, SourceMetrics m) {
        return """
                You are analyzing news media coverage signals from GDELT for "%s".

                Data provided:
                - Article counts: 30d=%d, 3m=%s, 1y=%s, total=%d
                - Unique domains: %s
                - Geographic diversity: %s countries
                - Average tone: %s (range: -1.0 to 1.0)
                - Media attention: %s
                - Coverage trend: %s
                - Sentiment trend: %s
                - Mainstream adoption: %s

                %s
                Interpretation guidance:
                - innovation_trigger: Low coverage (<50 articles), niche media, few domains, limited geography
                - peak: Very high coverage (>500 articles), mainstream media, many domains, positive tone, increasing trend
                - trough: Declining coverage from peak, negative tone shift, decreasing trend
                - slope: Stabilizing coverage, improving tone, steady trend, broadening media
                - plateau: Sustained moderate coverage, neutral tone, stable trend, mainstream domains

                Based on these news media signals, classify the hype cycle phase.

                %s""".formatted(keyword,
                m.recentVolume(), count(m, "articles_3m"), count(m, "articles_1y"), m.totalVolume(),
                count(m, "unique_domains"), count(m, "geographic_diversity"),
                decimal(m, "avg_tone", 2),
                m.text("media_attention", "unknown"), m.text("coverage_trend", "unknown"),
                m.text("sentiment_trend", "unknown"), m.text("mainstream_adoption", "unknown"),
                PHASE_DEFINITIONS, opinionFormat("1-2 sentence explanation"));
    }

    private static String financePrompt(String keyword, SourceMetrics m) {
        return """
                You are analyzing financial market signals from Yahoo Finance for "%s".

                Data provided:
                - Companies found: %d (%s)
                - Price changes: 1m=%s%%, 6m=%s%%, 2y=%s%%
                - Volatility (annualized): 1m=%s%%, 6m=%s%%
                - Volume trend: %s
                - Market maturity: %s
                - Investor sentiment: %s
                - Investment momentum: %s

                %s
                Interpretation guidance:
                - innovation_trigger: Few companies (<3), high volatility (>30%%)
                - peak: Many companies (>10), strong positive returns, high volatility, accelerating momentum, positive sentiment
                - trough: Declining returns from peak, negative price changes, very high volatility, negative sentiment
                - slope: Stabilizing returns, improving sentiment, moderate volatility, steady momentum, developing maturity
                - plateau: Stable moderate returns, neutral sentiment, low volatility (<15%%), mature market

                Based on these financial market signals, classify the hype cycle phase.

                %s""".formatted(keyword,
                m.recentVolume(), m.text("tickers", "[]"),
                percent(m, "avg_price_change_1m"), percent(m, "avg_price_change_6m"), percent(m, "avg_price_change_2y"),
                percent(m, "avg_volatility_1m"), percent(m, "avg_volatility_6m"),
                m.text("volume_trend", "unknown"), m.text("market_maturity", "unknown"),
                m.text("investor_sentiment", "unknown"), m.text("investment_momentum", "unknown"),
                PHASE_DEFINITIONS, opinionFormat("1-2 sentence explanation"));
    }

    /**
     * Synthesis prompt over the per-source opinions, listed in canonical source order.
     */
    public static String synthesisPrompt(String keyword, Map<SourceName, PhaseOpinion> opinions) {
        List<String> summaries = new ArrayList<>();
        int index = 1;
        for (SourceName source : SourceName.values()) {
            PhaseOpinion opinion = opinions.get(source);
            if (opinion == null) {
                continue;
            }
            summaries.add("""
                    %d. %s:
                       Phase: %s
                       Confidence: %s
                       Reasoning: %s""".formatted(index++, source.label(), opinion.phase().wireName(),
                    String.format(Locale.ROOT, "%.2f", opinion.confidence()), opinion.reasoning()));
        }

        return """
                You are an expert technology analyst synthesizing multiple data sources to determine the definitive hype cycle position for "%s".

                You have analyzed this technology from %d independent perspectives:

                %s

                %s
                Synthesize these perspectives into ONE final classification. Consider:
                - Conflicting signals may indicate transition phases
                - Weight sources by confidence scores
                - Social media trends faster than academic validation
                - Patents and finance lag behind hype but indicate real investment
                - News coverage bridges mainstream adoption
                - Recent data (social, news) vs. slower indicators (papers, patents)

                %s""".formatted(keyword, opinions.size(), String.join("\n\n", summaries), PHASE_DEFINITIONS,
                opinionFormat("2-3 sentence explanation synthesizing key evidence from all sources"));
    }

    /**
     * Query expansion prompt asking for related search terms.
     */
    public static String expansionPrompt(String keyword) {
        return """
                "%s" is a niche technology with little direct discussion online.
                Suggest 3 to 5 closely related search terms that the same community, researchers, \
                inventors and journalists would use when writing about it: synonyms, the broader \
                field it belongs to, or its best-known concrete techniques.

                Requirements:
                - Each term is 1-4 words
                - Do not repeat "%s" itself
                - Avoid generic words such as "technology", "system" or "innovation"

                Return ONLY a JSON object with no markdown formatting:
                {"terms": ["term one", "term two", "term three"]}""".formatted(keyword, keyword);
    }

    private static String opinionFormat(String reasoningHint) {
        return OPINION_FORMAT.formatted(reasoningHint);
    }

    private static String count(SourceMetrics m, String field) {
        return String.valueOf((long) m.number(field, 0));
    }

    private static String decimal(SourceMetrics m, String field, int places) {
        return String.format(Locale.ROOT, "%." + places + "f", m.number(field, 0));
    }

    private static String percent(SourceMetrics m, String field) {
        return String.format(Locale.ROOT, "%.1f", m.number(field, 0) * 100);
    }
}
