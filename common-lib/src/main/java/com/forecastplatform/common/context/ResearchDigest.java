package com.forecastplatform.common.context;

import com.forecastplatform.common.model.ResearchResult;
import com.forecastplatform.common.model.Source;

import java.util.List;

/**
 * Renders a {@link ResearchResult} as the text block handed to probability synthesis.
 *
 * <pre>
 *   Research Summary (&lt;confidence&gt; confidence):
 *   &lt;summary&gt;
 *
 *   Queries Executed:
 *   1. ...
 *
 *   Sources:
 *   Source 1: &lt;title&gt;
 *   URL: &lt;url&gt;
 *   &lt;snippet&gt;
 * </pre>
 */
public final class ResearchDigest {

    public static final String NO_FINDINGS = "No research findings available.";

    private static final String SOURCE_SEPARATOR = "\n\n---\n\n";

    private ResearchDigest() {}

    public static String format(ResearchResult research) {
        if (research == null || research.sources().isEmpty()) {
            return NO_FINDINGS;
        }

        StringBuilder queries = new StringBuilder();
        List<String> executed = research.queries();
        for (int i = 0; i < executed.size(); i++) {
            queries.append(i + 1).append(". ").append(executed.get(i)).append('\n');
        }

        StringBuilder sources = new StringBuilder();
        List<Source> cited = research.sources();
        for (int i = 0; i < cited.size(); i++) {
            Source s = cited.get(i);
            if (i > 0) sources.append(SOURCE_SEPARATOR);
            sources.append("Source ").append(i + 1).append(": ").append(s.title()).append('\n')
                   .append("URL: ").append(s.url()).append('\n')
                   .append(s.snippet());
        }

        return "Research Summary (" + research.confidence() + " confidence):\n"
            + research.summary() + "\n\n"
            + "Queries Executed:\n" + queries + "\n"
            + "Sources:\n" + sources;
    }
}
