package net.kyver.relink.processor.impl;

import net.kyver.relink.core.CancellationSignal;
import net.kyver.relink.core.replacement.ReplacementRules;
import net.kyver.relink.processor.BatchReport;
import net.kyver.relink.processor.DirectoryReplacer;
import net.kyver.relink.processor.FileContext;
import net.kyver.relink.processor.FileRule;
import net.kyver.relink.processor.FileRuleRegistry;

import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Rewrites a mirrored static site so it can be served from another domain.
 * <p>
 * Absolute links to the old domain become root relative, except inside Twitter/Open Graph
 * metadata where crawlers need a full URL and the new domain is written instead. Generator
 * meta tags and feedly subscription prefixes are dropped and links to {@code index.html}
 * are shortened to their directory.
 */
public final class LinkRewriteRules {

    public static final String RULE_NAME = "html-css-links";

    static final Pattern GENERATOR_META = Pattern.compile(
            "\\s*<meta\\s+name\\s*=\\s*[\"']generator[\"']\\s+content\\s*=\\s*[\"'][^\"']+['\"][^>]+>",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    static final Pattern FEEDLY_PREFIX = Pattern.compile(
            "https://feedly\\.com/i/subscription/feed/",
            Pattern.CASE_INSENSITIVE);

    static final Pattern RELATIVE_INDEX = Pattern.compile(
            "(href=[\"']((?!https?://)[^\"']+)).+(index\\.html)",
            Pattern.CASE_INSENSITIVE);

    static final Pattern INDEX_HTML = Pattern.compile(
            "(href\\s*=\\s*[\"'])\\s*index.html\\s*([\"'])",
            Pattern.CASE_INSENSITIVE);

    private LinkRewriteRules() {
    }

    static Pattern absoluteLink(String domain) {
        return Pattern.compile("((twitter|og):(url|image).*)?(https?://" + Pattern.quote(domain) + "/?)");
    }

    /**
     * Replacement rules for a single HTML or CSS document.
     */
    public static ReplacementRules<FileContext> documentRules(String domain, String newDomain) {
        requireDomain(domain, "Domain");
        requireDomain(newDomain, "New domain");

        return ReplacementRules.<FileContext>builder()
                .remove(GENERATOR_META)
                .remove(FEEDLY_PREFIX)
                .add(absoluteLink(domain), (match, context, count) -> {
                    String metadata = match.group(1);
                    return metadata != null ? metadata + newDomain + "/" : "/";
                })
                .add(RELATIVE_INDEX, (match, context, count) -> match.group(1))
                .add(INDEX_HTML, (match, context, count) -> match.group(1) + "." + match.group(2))
                .build();
    }

    public static FileRuleRegistry forDomain(String domain, String newDomain) {
        return new FileRuleRegistry()
                .register(FileRule.forExtensions(RULE_NAME, documentRules(domain, newDomain), ".html", ".css"));
    }

    public static BatchReport rewrite(DirectoryReplacer replacer,
                                      Path dir,
                                      String domain,
                                      String newDomain,
                                      CancellationSignal signal) {
        return replacer.replaceInDirectory(dir, forDomain(domain, newDomain), signal);
    }

    private static void requireDomain(String value, String label) {
        Objects.requireNonNull(value, label + " cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(label + " cannot be blank");
        }
    }
}
